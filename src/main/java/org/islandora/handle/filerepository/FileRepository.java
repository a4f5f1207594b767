package org.islandora.handle.filerepository;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.exceptions.RepositoryObjectNotFoundException;

/**
 * FileRepository keeps repository objects on disk. Every object lives in a directory addressed by
 * the hex digest of its pid, sharded by the configured depth and width, and holds an
 * `object.yaml` (pid and content models) plus one file per datastream under `datastreams/`. To
 * instantiate FileRepository, the calling app must provide the properties described by the
 * constructor.
 */
public class FileRepository {
    private static final Log logFileRepository = LogFactory.getLog(FileRepository.class);
    private final Path REPOSITORY_ROOT;
    private final int DIRECTORY_DEPTH;
    private final int DIRECTORY_WIDTH;
    private final String OBJECT_ADDRESS_ALGORITHM;
    private final Path OBJECT_STORE_DIRECTORY;
    private final Path TMP_FILE_DIRECTORY;

    public static final String REPOSITORY_YAML = "repository.yaml";
    public static final String OBJECT_YAML = "object.yaml";
    public static final String DATASTREAM_DIRECTORY = "datastreams";

    public enum FileRepositoryProperties {
        repositoryPath, storeDepth, storeWidth, storeAlgorithm
    }

    /**
     * Constructor to initialize FileRepository. If a `repository.yaml` is already present at the
     * repository path, the supplied properties must match it; otherwise it is written.
     *
     * @param repositoryProperties Properties object with the keys: repositoryPath, storeDepth,
     *                             storeWidth, storeAlgorithm
     * @throws IllegalArgumentException Missing properties, depth or width less than 1, or a
     *                                  mismatch with an existing `repository.yaml`
     * @throws IOException              Issue with creating directories or reading configuration
     * @throws NoSuchAlgorithmException Unsupported store algorithm
     */
    public FileRepository(Properties repositoryProperties) throws IllegalArgumentException,
        IOException, NoSuchAlgorithmException {
        logFileRepository.info("Initializing FileRepository");
        FileRepositoryUtility.ensureNotNull(
            repositoryProperties, "repositoryProperties", "FileRepository - constructor");

        String repositoryPath = repositoryProperties.getProperty(
            FileRepositoryProperties.repositoryPath.name());
        String storeDepth = repositoryProperties.getProperty(
            FileRepositoryProperties.storeDepth.name(), "3");
        String storeWidth = repositoryProperties.getProperty(
            FileRepositoryProperties.storeWidth.name(), "2");
        String storeAlgorithm = repositoryProperties.getProperty(
            FileRepositoryProperties.storeAlgorithm.name(), "SHA-256");
        FileRepositoryUtility.ensureNotNull(
            repositoryPath, "repositoryPath", "FileRepository - constructor");

        Path rootPath = Paths.get(repositoryPath);
        int depth = Integer.parseInt(storeDepth);
        int width = Integer.parseInt(storeWidth);
        verifyRepositoryProperties(rootPath, depth, width, storeAlgorithm);

        REPOSITORY_ROOT = rootPath;
        DIRECTORY_DEPTH = depth;
        DIRECTORY_WIDTH = width;
        OBJECT_ADDRESS_ALGORITHM = storeAlgorithm;
        OBJECT_STORE_DIRECTORY = rootPath.resolve("objects");
        TMP_FILE_DIRECTORY = rootPath.resolve("tmp");

        try {
            Files.createDirectories(OBJECT_STORE_DIRECTORY);
            Files.createDirectories(TMP_FILE_DIRECTORY);

        } catch (IOException ioe) {
            logFileRepository.fatal("Failed to initialize FileRepository - unable to create"
                                        + " directories. Exception: " + ioe.getMessage());
            throw ioe;
        }

        Path repositoryYaml = REPOSITORY_ROOT.resolve(REPOSITORY_YAML);
        if (!Files.exists(repositoryYaml)) {
            writeRepositoryYaml(
                buildRepositoryYamlString(DIRECTORY_DEPTH, DIRECTORY_WIDTH, OBJECT_ADDRESS_ALGORITHM));
            logFileRepository.info("repository.yaml written to: " + repositoryYaml);
        }
        logFileRepository.debug(
            "FileRepository initialized. Store Depth: " + DIRECTORY_DEPTH + ". Store Width: "
                + DIRECTORY_WIDTH + ". Store Algorithm: " + OBJECT_ADDRESS_ALGORITHM);
    }

    /**
     * Validate the supplied layout and, when a `repository.yaml` already exists, make sure it
     * describes the same layout.
     */
    protected void verifyRepositoryProperties(
        Path repositoryPath, int storeDepth, int storeWidth, String storeAlgorithm
    ) throws NoSuchAlgorithmException, IOException, IllegalArgumentException {
        if (storeDepth <= 0 || storeWidth <= 0) {
            String errMsg =
                "Depth and width must be > than 0. Depth: " + storeDepth + ". Width: " + storeWidth;
            logFileRepository.fatal(errMsg);
            throw new IllegalArgumentException(errMsg);
        }
        // Throws NoSuchAlgorithmException when unsupported
        FileRepositoryUtility.getPidHexDigest("verify", storeAlgorithm);

        Path repositoryYaml = repositoryPath.resolve(REPOSITORY_YAML);
        if (Files.exists(repositoryYaml)) {
            logFileRepository.debug("repository.yaml found, checking properties.");
            HashMap<?, ?> existing = readYaml(repositoryYaml);
            FileRepositoryUtility.checkObjectEquality(
                "store depth", storeDepth, existing.get("store_depth"));
            FileRepositoryUtility.checkObjectEquality(
                "store width", storeWidth, existing.get("store_width"));
            FileRepositoryUtility.checkObjectEquality(
                "store algorithm", storeAlgorithm, existing.get("store_algorithm"));
            logFileRepository.info("repository.yaml found and FileRepository verified");
        }
    }

    /**
     * Build the string content of 'repository.yaml'
     */
    protected String buildRepositoryYamlString(
        int storeDepth, int storeWidth, String storeAlgorithm) {
        return String.format(
            "# Layout of this repository, do not change once objects have been created\n\n"
                + "# Number of directories used to shard the digest of a pid\n"
                + "store_depth: %d\n"
                + "# Number of characters in each sharded directory name\n"
                + "store_width: %d\n"
                + "# Algorithm used to calculate the digest of a pid\n"
                + "store_algorithm: \"%s\"\n", storeDepth, storeWidth, storeAlgorithm);
    }

    protected void writeRepositoryYaml(String yamlString) throws IOException {
        Path repositoryYaml = REPOSITORY_ROOT.resolve(REPOSITORY_YAML);
        try (BufferedWriter writer = new BufferedWriter(
            new OutputStreamWriter(Files.newOutputStream(repositoryYaml), StandardCharsets.UTF_8)
        )) {
            writer.write(yamlString);

        } catch (IOException ioe) {
            logFileRepository.fatal(
                "Unable to write 'repository.yaml'. IOException: " + ioe.getMessage());
            throw ioe;
        }
    }

    /**
     * Create a new, empty repository object.
     *
     * @param pid           Persistent identifier
     * @param contentModels Content models, in declaration order
     * @return The new object
     * @throws FileAlreadyExistsException When an object already exists for the pid
     * @throws IOException                When the object cannot be written
     * @throws NoSuchAlgorithmException   When the address of the object cannot be calculated
     */
    public FileRepositoryObject createObject(String pid, Collection<String> contentModels)
        throws FileAlreadyExistsException, IOException, NoSuchAlgorithmException {
        logFileRepository.debug("Creating repository object for pid: " + pid);
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "createObject");
        FileRepositoryUtility.ensureNotNull(contentModels, "contentModels", "createObject");
        for (String contentModel : contentModels) {
            FileRepositoryUtility.checkForEmptyAndValidString(
                contentModel, "contentModel", "createObject");
        }

        Path objectDirectory = getObjectDirectory(pid);
        Path objectYaml = objectDirectory.resolve(OBJECT_YAML);
        if (Files.exists(objectYaml)) {
            String errMsg = "Repository object already exists for pid: " + pid;
            logFileRepository.error(errMsg);
            throw new FileAlreadyExistsException(errMsg);
        }
        Files.createDirectories(objectDirectory.resolve(DATASTREAM_DIRECTORY));

        Map<String, Object> objectProperties = new LinkedHashMap<>();
        objectProperties.put("pid", pid);
        objectProperties.put("content_models", new ArrayList<>(new LinkedHashSet<>(contentModels)));
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        writeFile(objectYaml, om.writeValueAsBytes(objectProperties), "object properties");

        logFileRepository.info("Repository object created for pid: " + pid);
        return new FileRepositoryObject(this, pid, contentModels, objectDirectory);
    }

    /**
     * Open an existing repository object.
     *
     * @param pid Persistent identifier
     * @return The object
     * @throws RepositoryObjectNotFoundException When no object exists for the pid
     * @throws IOException                       When `object.yaml` cannot be read
     * @throws NoSuchAlgorithmException          When the address of the object cannot be
     *                                           calculated
     */
    public FileRepositoryObject getObject(String pid)
        throws RepositoryObjectNotFoundException, IOException, NoSuchAlgorithmException {
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "getObject");
        Path objectDirectory = getObjectDirectory(pid);
        Path objectYaml = objectDirectory.resolve(OBJECT_YAML);
        if (!Files.exists(objectYaml)) {
            String errMsg =
                "Repository object does not exist for pid: " + pid + " at: " + objectDirectory;
            logFileRepository.warn(errMsg);
            throw new RepositoryObjectNotFoundException(errMsg);
        }

        HashMap<?, ?> objectProperties = readYaml(objectYaml);
        FileRepositoryUtility.checkObjectEquality("pid", pid, objectProperties.get("pid"));
        List<String> contentModels = new ArrayList<>();
        Object models = objectProperties.get("content_models");
        if (models instanceof List<?>) {
            for (Object model : (List<?>) models) {
                contentModels.add(model.toString());
            }
        }
        logFileRepository.debug("Retrieved repository object for pid: " + pid);
        return new FileRepositoryObject(this, pid, contentModels, objectDirectory);
    }

    /**
     * @param pid Persistent identifier
     * @return True if an object exists for the pid
     * @throws NoSuchAlgorithmException When the address of the object cannot be calculated
     */
    public boolean objectExists(String pid) throws NoSuchAlgorithmException {
        FileRepositoryUtility.checkForEmptyAndValidString(pid, "pid", "objectExists");
        return Files.exists(getObjectDirectory(pid).resolve(OBJECT_YAML));
    }

    /**
     * Get the absolute path to the directory of a repository object
     *
     * @param pid Persistent identifier
     * @return Path to the object directory
     * @throws NoSuchAlgorithmException When the store algorithm is not supported
     */
    protected Path getObjectDirectory(String pid) throws NoSuchAlgorithmException {
        String hashedId = FileRepositoryUtility.getPidHexDigest(pid, OBJECT_ADDRESS_ALGORITHM);
        String objectRelativePath = FileRepositoryUtility.getHierarchicalPathString(
            DIRECTORY_DEPTH, DIRECTORY_WIDTH, hashedId);
        return OBJECT_STORE_DIRECTORY.resolve(objectRelativePath);
    }

    /**
     * Write content to a tmp file and move it to its permanent location, replacing what was
     * there.
     *
     * @param target  Permanent location
     * @param content Content to write
     * @param entity  What is being written, for logging
     * @throws IOException When the content cannot be written or moved
     */
    protected void writeFile(Path target, byte[] content, String entity) throws IOException {
        File tmpFile = FileRepositoryUtility.generateTmpFile("tmp", TMP_FILE_DIRECTORY);
        try {
            Files.write(tmpFile.toPath(), content);
            move(tmpFile, target.toFile(), entity);

        } finally {
            Files.deleteIfExists(tmpFile.toPath());
        }
    }

    /**
     * Move a file atomically, creating the parent directory of the target when needed.
     *
     * @param source File to move
     * @param target Where to move it
     * @param entity What is being moved, for logging
     * @throws AtomicMoveNotSupportedException When the tmp directory is on another file system
     * @throws IOException                     When the file cannot be moved
     */
    protected void move(File source, File target, String entity) throws IOException {
        logFileRepository.debug(
            "Moving " + entity + ", from source: " + source + ", to target: " + target);
        Path destinationDirectory = target.toPath().getParent();
        if (!Files.exists(destinationDirectory)) {
            try {
                Files.createDirectories(destinationDirectory);

            } catch (FileAlreadyExistsException faee) {
                logFileRepository.warn("Directory already exists at: " + destinationDirectory
                                           + " - Skipping directory creation");
            }
        }

        try {
            Files.move(source.toPath(), target.toPath(), StandardCopyOption.ATOMIC_MOVE,
                       StandardCopyOption.REPLACE_EXISTING);

        } catch (AtomicMoveNotSupportedException amnse) {
            logFileRepository.error("StandardCopyOption.ATOMIC_MOVE failed. AtomicMove is"
                                        + " not supported across file systems. Source: " + source
                                        + ". Target: " + target);
            throw amnse;

        } catch (IOException ioe) {
            logFileRepository.error(
                "Unable to move " + entity + ". Source: " + source + ". Target: " + target);
            throw ioe;
        }
    }

    private static HashMap<?, ?> readYaml(Path yamlPath) throws IOException {
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        try {
            return om.readValue(yamlPath.toFile(), HashMap.class);

        } catch (IOException ioe) {
            logFileRepository.fatal(
                "Unable to read: " + yamlPath + ". IOException: " + ioe.getMessage());
            throw ioe;
        }
    }

    public Path getRepositoryRoot() {
        return REPOSITORY_ROOT;
    }
}
