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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class VersionGuardTests extends DatastoreTestCase {

    public void testFromInfo() {
        VersionGuard guard = VersionGuard.fromInfo(json("{\"version\":{\"distribution\":\"opensearch\",\"number\":\"2.11.0\"}}"));
        assertEquals(VersionGuard.OPENSEARCH, guard.getDistribution());
        assertEquals(new EngineVersion(2, 11, 0), guard.getVersion());
        assertEquals(VersionGuard.MIN_OPENSEARCH_VERSION, guard.getMinimumVersion());
    }

    public void testDistributionDefaultsToElasticsearch() {
        VersionGuard guard = VersionGuard.fromInfo(json("{\"version\":{\"number\":\"7.17.9\",\"build_flavor\":\"default\"}}"));
        assertEquals(VersionGuard.ELASTICSEARCH, guard.getDistribution());
        assertEquals(VersionGuard.MIN_ELASTICSEARCH_VERSION, guard.getMinimumVersion());
        assertTrue(guard.isSupportedVersion(guard.getMinimumVersion()));
        assertFalse(guard.isSupportedVersion(EngineVersion.fromString("8.0.0")));
    }

    public void testMissingVersion() {
        try {
            VersionGuard.fromInfo(json("{\"name\":\"node-1\"}"));
            fail("expected a missing version to be reported");
        } catch (DatastoreException e) {
            assertTrue(e.getMessage().contains("no version number"));
        }
    }
}
