package org.islandora.handle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.islandora.handle.dublincore.DublinCoreUtility;
import org.islandora.handle.filerepository.FileRepository;
import org.islandora.handle.testdata.FakeHandleServer;
import org.islandora.handle.testdata.TestDataHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

public class ClientTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private static final String PID = "islandora:1";
    private FakeHandleServer server;
    private String storePath;
    private String configPath;

    /**
     * Temporary folder for tests to run in
     */
    @TempDir
    public Path tempFolder;

    @BeforeEach
    public void initializeRepository() {
        try {
            server = new FakeHandleServer();
            server.start();
            storePath = tempFolder.resolve("repository").toString();
            String[] args = {"-crs", "-store", storePath, "-dp", "3", "-wp", "2", "-ap", "SHA-256"};
            assertEquals(0, Client.run(args));

            Path configYaml = tempFolder.resolve("handle.yaml");
            Files.writeString(
                configYaml,
                "handle_service_url: \"" + server.getServiceUrl() + "\"\n"
                    + "handle_prefix: \"" + TestDataHarness.HANDLE_PREFIX + "\"\n"
                    + "handle_username: \"admin\"\n"
                    + "handle_password: \"secret\"\n"
                    + "target_url_template: \"https://repository.example.org/object/[[PID]]\"\n"
                    + "handle_service_timeout: 5\n"
                    + "associations:\n"
                    + "  - content_model: \"" + TestDataHarness.IMAGE_MODEL + "\"\n"
                    + "    datastream: \"MODS\"\n"
                    + "    transform: \"xsl/add_handle_identifier_mods.xsl\"\n");
            configPath = configYaml.toString();

            Path mods = tempFolder.resolve("mods.xml");
            Files.write(mods, testData.getMods(PID));
            Path dc = tempFolder.resolve("dc.xml");
            Files.write(dc, testData.getDublinCore(PID, PID));

            Client.run(new String[]{"-store", storePath, "-createobject", "-pid", PID, "-models",
                TestDataHarness.IMAGE_MODEL});
            Client.run(new String[]{"-store", storePath, "-putds", "-pid", PID, "-dsid", "MODS",
                "-path", mods.toString()});
            Client.run(new String[]{"-store", storePath, "-putds", "-pid", PID, "-dsid", "DC",
                "-path", dc.toString()});

        } catch (Exception e) {
            e.printStackTrace();
            fail("ClientTest - Exception encountered: " + e.getMessage());

        }
    }

    @AfterEach
    public void stopServer() {
        server.stop();
    }

    private String runCapturingOutput(String[] args, int expectedStatus) throws Exception {
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(outputStream, true, StandardCharsets.UTF_8);
        PrintStream old = System.out;
        System.setOut(ps);
        try {
            assertEquals(expectedStatus, Client.run(args));
        } finally {
            System.out.flush();
            System.setOut(old);
        }
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    /**
     * Check that the client creates the repository layout
     */
    @Test
    public void client_createRepository() {
        Path repository = Path.of(storePath);
        assertTrue(Files.exists(repository.resolve(FileRepository.REPOSITORY_YAML)));
        assertTrue(Files.isDirectory(repository.resolve("objects")));
    }

    /**
     * Check that datastreams written through the client are listed
     */
    @Test
    public void client_listDatastreams() throws Exception {
        String output = runCapturingOutput(
            new String[]{"-store", storePath, "-listds", "-pid", PID}, 0);

        assertTrue(output.contains("[DC, MODS]"));
        assertTrue(output.contains(TestDataHarness.IMAGE_MODEL));
    }

    /**
     * Check the full life cycle of a Handle through the client
     */
    @Test
    public void client_reconcileLifeCycle() throws Exception {
        String handleUrl = testData.pidData.get(PID).get("handle");

        String ensureOutput = runCapturingOutput(new String[]{
            "-store", storePath, "-config", configPath, "-ensure", "-pid", PID, "-dsid", "MODS"},
            0);
        assertTrue(server.handles.containsKey(TestDataHarness.HANDLE_PREFIX + "/" + PID));
        assertTrue(ensureOutput.contains("[user-notice/INFO] Created the Handle " + handleUrl));

        String syncOutput = runCapturingOutput(new String[]{
            "-store", storePath, "-config", configPath, "-syncdc", "-pid", PID}, 0);
        assertTrue(syncOutput.contains("Updated the Dublin Core of " + PID));
        Path repository = Path.of(storePath);
        FileRepository fileRepository = new FileRepository(propertiesFor(repository));
        List<Element> identifiers = DublinCoreUtility.findIdentifiers(DublinCoreUtility.parse(
            fileRepository.getObject(PID).getDatastreamContent("DC")));
        assertEquals(handleUrl, identifiers.get(identifiers.size() - 1).getTextContent());

        // The Handle stays while MODS is present
        runCapturingOutput(new String[]{
            "-store", storePath, "-config", configPath, "-retract", "-pid", PID}, 0);
        assertFalse(server.handles.isEmpty());

        Client.run(new String[]{"-store", storePath, "-purgeds", "-pid", PID, "-dsid", "MODS"});
        String retractOutput = runCapturingOutput(new String[]{
            "-store", storePath, "-config", configPath, "-retract", "-pid", PID}, 0);
        assertTrue(server.handles.isEmpty());
        assertTrue(retractOutput.contains("Deleted the Handle " + handleUrl));
    }

    /**
     * Check that a failed reconciliation gives a non zero status
     */
    @Test
    public void client_failedReconciliation() throws Exception {
        server.forcedCode = 403;
        server.forcedBody = "Not authorized";

        String output = runCapturingOutput(new String[]{
            "-store", storePath, "-config", configPath, "-syncdc", "-pid", PID}, 1);

        assertTrue(output.contains("[operational-log/ERROR]"));
        assertTrue(output.contains("failure"));
    }

    /**
     * Check that a missing repository is reported
     */
    @Test
    public void client_missingRepository() {
        String missing = tempFolder.resolve("missing").toString();

        assertThrows(
            FileNotFoundException.class,
            () -> Client.run(new String[]{"-store", missing, "-listds", "-pid", PID}));
    }

    /**
     * Check that reconciliation requires a configuration
     */
    @Test
    public void client_missingConfig() {
        assertThrows(
            IllegalArgumentException.class,
            () -> Client.run(new String[]{"-store", storePath, "-syncdc", "-pid", PID}));
    }

    private static Properties propertiesFor(Path repository) {
        Properties properties = new Properties();
        properties.setProperty("repositoryPath", repository.toString());
        return properties;
    }
}
