package org.islandora.handle.testdata;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/*
 * This class returns the test data shared by the reconciliation tests
 *
 * Notes:
 * - "handle" is the canonical Handle URL of the pid under the prefix "1234.5"
 * - "object_cid" is the SHA-256 hash of the pid
 */
public class TestDataHarness {
    public static final String HANDLE_PREFIX = "1234.5";
    public static final String IMAGE_MODEL = "islandora:sp_basic_image";
    public static final String BOOK_MODEL = "islandora:bookCModel";

    public Map<String, Map<String, String>> pidData;
    public String[] pidList = {"islandora:1", "test:image.42", "urn:uuid:6e1c1f8d-3b8a"};

    public TestDataHarness() {
        Map<String, Map<String, String>> pidsAndValues = new HashMap<>();

        Map<String, String> values1 = new HashMap<>();
        values1.put("handle", "http://hdl.handle.net/1234.5/islandora:1");
        values1.put("title", "Sunset over the harbour");
        pidsAndValues.put("islandora:1", values1);

        Map<String, String> values2 = new HashMap<>();
        values2.put("handle", "http://hdl.handle.net/1234.5/test:image.42");
        values2.put("title", "Portrait of a lighthouse keeper");
        pidsAndValues.put("test:image.42", values2);

        Map<String, String> values3 = new HashMap<>();
        values3.put("handle", "http://hdl.handle.net/1234.5/urn:uuid:6e1c1f8d-3b8a");
        values3.put("title", "Map of the northern coast");
        pidsAndValues.put("urn:uuid:6e1c1f8d-3b8a", values3);

        this.pidData = pidsAndValues;
    }

    /**
     * Dublin Core document of the pid, holding the given identifiers in order
     */
    public byte[] getDublinCore(String pid, String... identifiers) {
        StringBuilder dc = new StringBuilder();
        dc.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        dc.append("<oai_dc:dc xmlns:oai_dc=\"http://www.openarchives.org/OAI/2.0/oai_dc/\"");
        dc.append(" xmlns:dc=\"http://purl.org/dc/elements/1.1/\">\n");
        dc.append("  <dc:title>").append(pidData.get(pid).get("title")).append("</dc:title>\n");
        for (String identifier : identifiers) {
            dc.append("  <dc:identifier>").append(identifier).append("</dc:identifier>\n");
        }
        dc.append("</oai_dc:dc>\n");
        return dc.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * MODS document of the pid without any Handle identifier
     */
    public byte[] getMods(String pid) {
        String mods = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<mods:mods xmlns:mods=\"http://www.loc.gov/mods/v3\">\n"
            + "  <mods:titleInfo>\n"
            + "    <mods:title>" + pidData.get(pid).get("title") + "</mods:title>\n"
            + "  </mods:titleInfo>\n"
            + "  <mods:identifier type=\"local\">" + pid + "</mods:identifier>\n"
            + "</mods:mods>\n";
        return mods.getBytes(StandardCharsets.UTF_8);
    }
}
