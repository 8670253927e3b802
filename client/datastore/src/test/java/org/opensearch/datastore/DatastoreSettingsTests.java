/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.datastore;

import org.opensearch.datastore.test.DatastoreTestCase;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DatastoreSettingsTests extends DatastoreTestCase {

    public void testDefaults() {
        DatastoreSettings settings = DatastoreSettings.defaults();
        assertEquals(Duration.ofSeconds(90), settings.getTransportTimeout());
        assertEquals(Paths.get("/etc/assemblyline/ssl/al_root-ca.crt"), settings.getRootCaPath());
        assertTrue(settings.isVerifyCerts());
        assertFalse(settings.isArchiveEnabled());
        assertTrue(settings.getArchiveIndices().isEmpty());
        assertEquals(settings.toString(), DatastoreSettings.fromEnvironment(Collections.emptyMap()).toString());
    }

    public void testFromEnvironment() {
        Map<String, String> environment = new HashMap<>();
        environment.put(DatastoreSettings.TRANSPORT_TIMEOUT_ENV, " 30 ");
        environment.put(DatastoreSettings.ROOT_CA_PATH_ENV, "/tmp/ca.crt");
        environment.put(DatastoreSettings.VERIFY_CERTS_ENV, randomFrom(new String[] { "false", "False", "no", "0" }));
        DatastoreSettings settings = DatastoreSettings.fromEnvironment(environment);
        assertEquals(Duration.ofSeconds(30), settings.getTransportTimeout());
        assertEquals(Paths.get("/tmp/ca.crt"), settings.getRootCaPath());
        assertFalse(settings.isVerifyCerts());

        environment.put(DatastoreSettings.VERIFY_CERTS_ENV, "TRUE");
        assertTrue(DatastoreSettings.fromEnvironment(environment).isVerifyCerts());
    }

    public void testInvalidTimeout() {
        for (String timeout : new String[] { "soon", "0", "-5" }) {
            try {
                DatastoreSettings.fromEnvironment(Collections.singletonMap(DatastoreSettings.TRANSPORT_TIMEOUT_ENV, timeout));
                fail("expected [" + timeout + "] to be rejected");
            } catch (IllegalArgumentException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    public void testArchiveIndicesOnlyWhenEnabled() {
        DatastoreSettings.Builder builder = DatastoreSettings.builder().setArchiveIndices(Arrays.asList("alert", "file"));
        assertTrue(builder.build().getArchiveIndices().isEmpty());
        assertEquals(Arrays.asList("alert", "file"), builder.setArchiveEnabled(true).build().getArchiveIndices());
    }
}
