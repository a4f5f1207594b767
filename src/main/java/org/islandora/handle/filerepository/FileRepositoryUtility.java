package org.islandora.handle.filerepository;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Stream;

import javax.xml.bind.DatatypeConverter;

/**
 * FileRepositoryUtility is a utility class that encapsulates argument checks and file handling
 * shared by FileRepository and the classes that work with it.
 */
public class FileRepositoryUtility {

    private static final Log log = LogFactory.getLog(FileRepositoryUtility.class);

    /**
     * Checks whether a given object is null and throws an exception if so
     *
     * @param object   Object to check
     * @param argument Value that is being checked
     * @param method   Calling method or class
     * @throws IllegalArgumentException If the object is null
     */
    public static void ensureNotNull(Object object, String argument, String method)
        throws IllegalArgumentException {
        if (object == null) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be null.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * Checks whether a given string is empty or contains white space, and throws an exception if
     * so
     *
     * @param string   String to check
     * @param argument Value that is being checked
     * @param method   Calling method
     * @throws IllegalArgumentException If the string is empty or contains white space
     */
    public static void checkForEmptyAndValidString(String string, String argument, String method)
        throws IllegalArgumentException {
        ensureNotNull(string, argument, method);
        if (string.trim().isEmpty()) {
            String errMsg = "Calling Method: " + method + "(): " + argument + " cannot be empty.";
            throw new IllegalArgumentException(errMsg);
        }
        if (!isValidString(string)) {
            String errMsg = "Calling Method: " + method + "(): " + argument
                + " contains empty white spaces, tabs or newlines.";
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * @param string String to check
     * @return True if the string holds no white space characters
     */
    public static boolean isValidString(String string) {
        for (int i = 0; i < string.length(); i++) {
            if (Character.isWhitespace(string.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Datastream ids double as file names, so besides the usual string checks they may not hold
     * path separators or be a relative path component.
     *
     * @param dsid   Datastream id
     * @param method Calling method
     * @throws IllegalArgumentException If the id is empty or cannot be used as a file name
     */
    public static void checkDatastreamId(String dsid, String method)
        throws IllegalArgumentException {
        checkForEmptyAndValidString(dsid, "dsid", method);
        if (!isStorableDatastreamId(dsid)) {
            String errMsg = "Calling Method: " + method + "(): dsid is not a valid datastream id: "
                + dsid;
            throw new IllegalArgumentException(errMsg);
        }
    }

    /**
     * @param dsid Datastream id
     * @return True if the id can be used as the file name of a datastream
     */
    public static boolean isStorableDatastreamId(String dsid) {
        return dsid != null && !dsid.trim().isEmpty() && isValidString(dsid)
            && !dsid.contains("/") && !dsid.contains("\\") && !dsid.equals(".")
            && !dsid.equals("..") && !dsid.endsWith("_delete");
    }

    /**
     * Given a string and supported algorithm returns the hex digest
     *
     * @param pid       Persistent identifier
     * @param algorithm string value (ex. SHA-256)
     * @return Hex digest of the given string in lower-case
     * @throws IllegalArgumentException String or algorithm cannot be null or empty
     * @throws NoSuchAlgorithmException Algorithm not supported
     */
    public static String getPidHexDigest(String pid, String algorithm)
        throws NoSuchAlgorithmException, IllegalArgumentException {
        checkForEmptyAndValidString(pid, "pid", "getPidHexDigest");
        checkForEmptyAndValidString(algorithm, "algorithm", "getPidHexDigest");

        MessageDigest stringMessageDigest = MessageDigest.getInstance(algorithm);
        stringMessageDigest.update(pid.getBytes(StandardCharsets.UTF_8));
        return DatatypeConverter.printHexBinary(stringMessageDigest.digest()).toLowerCase();
    }

    /**
     * Generates a hierarchical path by dividing a given digest into tokens of fixed width, and
     * concatenating them with '/' as the delimiter.
     *
     * @param depth  integer to represent number of directories
     * @param width  width of each directory
     * @param digest value to shard
     * @return String
     */
    public static String getHierarchicalPathString(int depth, int width, String digest) {
        Collection<String> tokens = new ArrayList<>();
        int digestLength = digest.length();
        for (int i = 0; i < depth; i++) {
            int start = Math.min(i * width, digestLength);
            int end = Math.min((i + 1) * width, digestLength);
            tokens.add(digest.substring(start, end));
        }
        if (depth * width < digestLength) {
            tokens.add(digest.substring(depth * width));
        }

        Collection<String> shards = new ArrayList<>();
        for (String token : tokens) {
            if (!token.trim().isEmpty()) {
                shards.add(token);
            }
        }
        return String.join("/", shards);
    }

    /**
     * Checks a directory for regular files (not descending into sub-directories)
     *
     * @param directory Directory to check
     * @return List of files, empty if the directory doesn't exist
     * @throws IOException If I/O occurs when accessing directory
     */
    public static List<Path> getFilesFromDir(Path directory) throws IOException {
        List<Path> filePaths = new ArrayList<>();
        if (Files.isDirectory(directory)) {
            try (Stream<Path> stream = Files.list(directory)) {
                stream.filter(Files::isRegularFile).sorted().forEach(filePaths::add);
            }
        }
        return filePaths;
    }

    /**
     * Creates an empty/temporary file in a given location. If this file is not moved, it will
     * be deleted upon JVM gracefully exiting or shutting down.
     *
     * @param prefix    string to prepend before tmp file
     * @param directory location to create tmp file
     * @return Temporary file ready to write into
     * @throws IOException       Issues with generating tmpFile
     * @throws SecurityException Insufficient permissions to create tmpFile
     */
    public static File generateTmpFile(String prefix, Path directory) throws IOException,
        SecurityException {
        Random rand = new Random();
        int randomNumber = rand.nextInt(1000000);
        String newPrefix = prefix + "-" + System.currentTimeMillis() + randomNumber;

        Path newPath = Files.createTempFile(directory, newPrefix, null);
        File newFile = newPath.toFile();
        newFile.deleteOnExit();
        return newFile;
    }

    /**
     * Rename the given path to the 'file name' + '_delete'
     *
     * @param pathToRename The path to the file to be renamed with '_delete'
     * @return Path to the file with '_delete' appended
     * @throws IOException Issue with renaming the given file path
     */
    public static Path renamePathForDeletion(Path pathToRename) throws IOException {
        ensureNotNull(pathToRename, "pathToRename", "renamePathForDeletion");
        if (!Files.exists(pathToRename)) {
            String errMsg = "Given path to file: " + pathToRename + " does not exist.";
            throw new FileNotFoundException(errMsg);
        }
        Path deletePath = pathToRename.resolveSibling(pathToRename.getFileName() + "_delete");
        Files.move(pathToRename, deletePath, StandardCopyOption.ATOMIC_MOVE);
        return deletePath;
    }

    /**
     * Delete all paths found in the given collection. Failures are logged and skipped.
     *
     * @param deleteList Paths to delete
     */
    public static void deleteListItems(Collection<Path> deleteList) {
        ensureNotNull(deleteList, "deleteList", "deleteListItems");
        for (Path deleteItem : deleteList) {
            if (Files.exists(deleteItem)) {
                try {
                    Files.delete(deleteItem);
                } catch (IOException ioe) {
                    log.warn("Attempted to delete: " + deleteItem + " but failed."
                                 + " Additional Details: " + ioe.getMessage());
                }
            }
        }
    }

    /**
     * Ensures that two objects are equal. If not, throws an IllegalArgumentException.
     *
     * @param nameValue     The name of the object being checked
     * @param suppliedValue The value supplied to compare
     * @param existingValue The existing value to compare with
     * @throws IllegalArgumentException If the supplied value is not equal to the existing value
     */
    public static void checkObjectEquality(
        String nameValue, Object suppliedValue, Object existingValue) {
        if (!Objects.equals(suppliedValue, existingValue)) {
            String errMsg =
                "FileRepository.checkConfigurationEquality() - Mismatch in " + nameValue + ": "
                    + suppliedValue + " does not match the existing configuration value: "
                    + existingValue;
            throw new IllegalArgumentException(errMsg);
        }
    }
}
