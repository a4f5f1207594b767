package org.islandora.handle.filerepository;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Properties;

import org.islandora.handle.exceptions.DatastreamNotFoundException;
import org.islandora.handle.exceptions.RepositoryObjectNotFoundException;
import org.islandora.handle.testdata.TestDataHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Test class for FileRepository and FileRepositoryObject
 */
public class FileRepositoryTest {
    private static final TestDataHarness testData = new TestDataHarness();
    private Path rootDirectory;
    private Properties repositoryProperties;
    private FileRepository repository;

    /**
     * Temporary folder for tests to run in
     */
    @TempDir
    public Path tempFolder;

    /**
     * Initialize FileRepository
     */
    @BeforeEach
    public void initializeFileRepository() {
        rootDirectory = tempFolder.resolve("repository");
        repositoryProperties = new Properties();
        repositoryProperties.setProperty("repositoryPath", rootDirectory.toString());
        repositoryProperties.setProperty("storeDepth", "3");
        repositoryProperties.setProperty("storeWidth", "2");
        repositoryProperties.setProperty("storeAlgorithm", "SHA-256");

        try {
            repository = new FileRepository(repositoryProperties);

        } catch (IOException ioe) {
            fail("IOException encountered: " + ioe.getMessage());

        } catch (NoSuchAlgorithmException nsae) {
            fail("NoSuchAlgorithmException encountered: " + nsae.getMessage());

        }
    }

    /**
     * Check that the repository layout is written
     */
    @Test
    public void constructor_createsLayout() {
        assertTrue(Files.isDirectory(rootDirectory.resolve("objects")));
        assertTrue(Files.isDirectory(rootDirectory.resolve("tmp")));
        assertTrue(Files.exists(rootDirectory.resolve(FileRepository.REPOSITORY_YAML)));
    }

    /**
     * Check that an existing repository opens with the same properties
     */
    @Test
    public void constructor_reopen() throws Exception {
        repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL));

        FileRepository reopened = new FileRepository(repositoryProperties);

        assertTrue(reopened.objectExists("islandora:1"));
    }

    /**
     * Check that properties conflicting with repository.yaml are rejected
     */
    @Test
    public void constructor_mismatchedDepth() {
        repositoryProperties.setProperty("storeDepth", "2");

        assertThrows(
            IllegalArgumentException.class, () -> new FileRepository(repositoryProperties));
    }

    /**
     * Check that a zero width is rejected
     */
    @Test
    public void constructor_illegalWidth() {
        Properties properties = new Properties();
        properties.setProperty("repositoryPath", tempFolder.resolve("other").toString());
        properties.setProperty("storeWidth", "0");

        assertThrows(IllegalArgumentException.class, () -> new FileRepository(properties));
    }

    /**
     * Check that an unknown algorithm is rejected
     */
    @Test
    public void constructor_unknownAlgorithm() {
        Properties properties = new Properties();
        properties.setProperty("repositoryPath", tempFolder.resolve("other").toString());
        properties.setProperty("storeAlgorithm", "SHA-999");

        assertThrows(NoSuchAlgorithmException.class, () -> new FileRepository(properties));
    }

    /**
     * Check that objects are stored under the sharded digest of the pid
     */
    @Test
    public void createObject_location() throws Exception {
        for (String pid : testData.pidList) {
            repository.createObject(pid, List.of(TestDataHarness.IMAGE_MODEL));

            String digest = FileRepositoryUtility.getPidHexDigest(pid, "SHA-256");
            Path objectDirectory = rootDirectory.resolve("objects").resolve(
                FileRepositoryUtility.getHierarchicalPathString(3, 2, digest));
            assertTrue(Files.exists(objectDirectory.resolve(FileRepository.OBJECT_YAML)));
            assertTrue(Files.isDirectory(
                objectDirectory.resolve(FileRepository.DATASTREAM_DIRECTORY)));
        }
    }

    /**
     * Check that an object keeps its content models
     */
    @Test
    public void getObject_contentModels() throws Exception {
        repository.createObject(
            "islandora:1", List.of(TestDataHarness.BOOK_MODEL, TestDataHarness.IMAGE_MODEL));

        FileRepositoryObject object = repository.getObject("islandora:1");

        assertEquals("islandora:1", object.getId());
        assertEquals(
            List.of(TestDataHarness.BOOK_MODEL, TestDataHarness.IMAGE_MODEL),
            List.copyOf(object.getContentModels()));
    }

    /**
     * Check that creating an object twice is rejected
     */
    @Test
    public void createObject_duplicate() throws Exception {
        repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL));

        assertThrows(
            FileAlreadyExistsException.class,
            () -> repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL)));
    }

    /**
     * Check that a missing object is reported
     */
    @Test
    public void getObject_missing() {
        assertThrows(
            RepositoryObjectNotFoundException.class, () -> repository.getObject("islandora:9"));
    }

    /**
     * Check writing, replacing and reading a datastream
     */
    @Test
    public void datastream_writeAndRead() throws Exception {
        FileRepositoryObject object =
            repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL));
        assertFalse(object.hasDatastream("MODS"));

        object.setDatastreamContent("MODS", testData.getMods("islandora:1"));
        object.setDatastreamContent("DC", testData.getDublinCore("islandora:1"));
        object.setDatastreamContent("MODS", testData.getMods("test:image.42"));

        FileRepositoryObject reopened = repository.getObject("islandora:1");
        assertTrue(reopened.hasDatastream("MODS"));
        assertArrayEquals(
            testData.getMods("test:image.42"), reopened.getDatastreamContent("MODS"));
        assertEquals(List.of("DC", "MODS"), reopened.listDatastreams());
    }

    /**
     * Check that a purged datastream is gone
     */
    @Test
    public void purgeDatastream() throws Exception {
        FileRepositoryObject object =
            repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL));
        object.setDatastreamContent("MODS", testData.getMods("islandora:1"));

        object.purgeDatastream("MODS");

        assertFalse(object.hasDatastream("MODS"));
        assertTrue(object.listDatastreams().isEmpty());
        assertThrows(DatastreamNotFoundException.class, () -> object.purgeDatastream("MODS"));
        assertThrows(
            DatastreamNotFoundException.class, () -> object.getDatastreamContent("MODS"));
    }

    /**
     * Check that datastream ids that are not plain file names are rejected
     */
    @Test
    public void datastream_invalidId() throws Exception {
        FileRepositoryObject object =
            repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL));

        assertThrows(
            IllegalArgumentException.class,
            () -> object.setDatastreamContent("../object.yaml", new byte[0]));
        assertThrows(
            IllegalArgumentException.class,
            () -> object.getDatastreamContent("MODS_delete"));
    }

    /**
     * Check that ids which cannot be stored are reported as absent
     */
    @Test
    public void hasDatastream_unstorableId() throws Exception {
        FileRepositoryObject object =
            repository.createObject("islandora:1", List.of(TestDataHarness.IMAGE_MODEL));
        object.setDatastreamContent("MODS", testData.getMods("islandora:1"));

        assertFalse(object.hasDatastream(".."));
        assertFalse(object.hasDatastream("MODS_delete"));
        assertFalse(object.hasDatastream("a/MODS"));
        assertFalse(object.hasDatastream("MO DS"));
        assertFalse(object.hasDatastream(""));
        assertTrue(object.hasDatastream("MODS"));
    }
}
