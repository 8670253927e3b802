/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import org.opensearch.datastore.test.DatastoreTestCase;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EngineVersionTests extends DatastoreTestCase {

    public void testFromString() {
        assertEquals(new EngineVersion(7, 10, 2), EngineVersion.fromString("7.10.2"));
        assertEquals(new EngineVersion(2, 11, 0), EngineVersion.fromString("2.11"));
        assertEquals(new EngineVersion(3, 0, 0), EngineVersion.fromString("3.0.0-SNAPSHOT"));
        assertEquals("8.1.3", EngineVersion.fromString("8.1.3-rc1").toString());
    }

    public void testInvalidVersions() {
        for (String version : new String[] { "", "7", "7.x.1", "1.2.3.4", "-1.0" }) {
            try {
                EngineVersion.fromString(version);
                fail("expected [" + version + "] to be rejected");
            } catch (IllegalArgumentException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    public void testOrdering() {
        EngineVersion min = EngineVersion.fromString("7.10.0");
        assertTrue(EngineVersion.fromString("7.10.0").onOrAfter(min));
        assertTrue(EngineVersion.fromString("7.17.9").onOrAfter(min));
        assertTrue(EngineVersion.fromString("8.0.0").onOrAfter(min));
        assertTrue(EngineVersion.fromString("7.9.3").before(min));
        assertTrue(EngineVersion.fromString("6.8.23").before(min));
        int major = randomIntBetween(0, 100);
        int minor = randomIntBetween(0, 100);
        EngineVersion version = new EngineVersion(major, minor, randomIntBetween(0, 100));
        assertEquals(0, version.compareTo(new EngineVersion(version.getMajor(), version.getMinor(), version.getRevision())));
        assertTrue(version.before(new EngineVersion(major, minor + 1, 0)));
    }
}
