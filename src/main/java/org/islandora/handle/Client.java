package org.islandora.handle;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.applier.XsltHandleApplier;
import org.islandora.handle.config.YamlConfigurationStore;
import org.islandora.handle.exceptions.HandleServiceFactoryException;
import org.islandora.handle.filerepository.FileRepository;
import org.islandora.handle.filerepository.FileRepositoryObject;
import org.islandora.handle.reconciler.HandleServiceReconciler;
import org.islandora.handle.service.HandleService;
import org.islandora.handle.service.HandleServiceFactory;
import org.islandora.handle.service.RestHandleService.HandleServiceProperties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Command line client that maintains objects in a FileRepository and reconciles their Handles
 * against the Handle service described by a `handle.yaml`.
 */
public class Client {
    private static final Log logClient = LogFactory.getLog(Client.class);
    private static FileRepository repository;

    public static void main(String[] args) throws Exception {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Parse the arguments and execute the requested action.
     *
     * @param args Command line arguments
     * @return 0 on success, 1 when a reconciliation reported a failure
     * @throws Exception When the repository or the configuration cannot be used
     */
    public static int run(String[] args) throws Exception {
        if (args.length == 0) {
            System.out.println("HandleClient - No arguments provided. Use flag '-h' for help.");
        }
        Options options = addHandleClientOptions();

        CommandLineParser parser = new DefaultParser(false);
        HelpFormatter formatter = new HelpFormatter();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);

            if (cmd.hasOption("h")) {
                formatter.printHelp("HandleClient", options);
                return 0;
            }

            if (!cmd.hasOption("store")) {
                String errMsg =
                    "HandleClient - store path must be supplied, use 'store=[path/to/repository]'";
                throw new IllegalArgumentException(errMsg);
            }
            Path storePath = Paths.get(cmd.getOptionValue("store"));
            if (cmd.hasOption("crs")) {
                createNewRepository(
                    storePath, cmd.getOptionValue("dp", "3"), cmd.getOptionValue("wp", "2"),
                    cmd.getOptionValue("ap", "SHA-256"));
                System.out.println("Repository created at: " + storePath);
                return 0;
            }
            if (!Files.exists(storePath.resolve(FileRepository.REPOSITORY_YAML))) {
                String errMsg = "HandleClient - Missing repository.yaml at storePath (" + storePath
                    + "), please create a repository with '-crs'. Use '-h' to see options.";
                throw new FileNotFoundException(errMsg);
            }
            initializeRepository(storePath);

            if (cmd.hasOption("createobject")) {
                String pid = cmd.getOptionValue("pid");
                String models = cmd.getOptionValue("models");
                ensureNotNull(pid, "-pid");
                ensureNotNull(models, "-models");
                List<String> contentModels = new ArrayList<>();
                for (String model : models.split(",")) {
                    if (!model.trim().isEmpty()) {
                        contentModels.add(model.trim());
                    }
                }
                repository.createObject(pid, contentModels);
                System.out.println("Object created for pid (" + pid + ").");

            } else if (cmd.hasOption("putds")) {
                String pid = cmd.getOptionValue("pid");
                String dsid = cmd.getOptionValue("dsid");
                String path = cmd.getOptionValue("path");
                ensureNotNull(pid, "-pid");
                ensureNotNull(dsid, "-dsid");
                ensureNotNull(path, "-path");
                repository.getObject(pid).setDatastreamContent(
                    dsid, Files.readAllBytes(Paths.get(path)));
                System.out.println("Datastream (" + dsid + ") written for pid (" + pid + ").");

            } else if (cmd.hasOption("purgeds")) {
                String pid = cmd.getOptionValue("pid");
                String dsid = cmd.getOptionValue("dsid");
                ensureNotNull(pid, "-pid");
                ensureNotNull(dsid, "-dsid");
                repository.getObject(pid).purgeDatastream(dsid);
                System.out.println("Datastream (" + dsid + ") purged for pid (" + pid + ").");

            } else if (cmd.hasOption("listds")) {
                String pid = cmd.getOptionValue("pid");
                ensureNotNull(pid, "-pid");
                FileRepositoryObject object = repository.getObject(pid);
                System.out.println("Content models: " + object.getContentModels());
                System.out.println("Datastreams: " + object.listDatastreams());

            } else if (cmd.hasOption("ensure") || cmd.hasOption("syncdc")
                || cmd.hasOption("retract")) {
                String pid = cmd.getOptionValue("pid");
                String config = cmd.getOptionValue("config");
                ensureNotNull(pid, "-pid");
                ensureNotNull(config, "-config");
                HandleReconciler reconciler = initializeReconciler(Paths.get(config));
                FileRepositoryObject object = repository.getObject(pid);

                ReconcileResult result;
                if (cmd.hasOption("ensure")) {
                    String dsid = cmd.getOptionValue("dsid");
                    ensureNotNull(dsid, "-dsid");
                    result = reconciler.ensureHandleAndAttach(object, new DerivativeHook(dsid));
                } else if (cmd.hasOption("syncdc")) {
                    result = reconciler.syncDublinCore(object);
                } else {
                    result = reconciler.retractIfOrphaned(object);
                }
                for (Message message : result.messages()) {
                    System.out.println(message);
                }
                System.out.println(
                    "Result for pid (" + pid + "): " + (result.success() ? "success" : "failure"));
                return result.success() ? 0 : 1;

            } else {
                System.out.println("HandleClient - No options found, use -h for help.");
            }

        } catch (ParseException e) {
            System.err.println("Error parsing cli arguments: " + e.getMessage());
            formatter.printHelp("HandleClient Options", options);
        }
        return 0;
    }

    /**
     * Returns an options object to use with Apache Commons CLI library to manage command line
     * options for the Handle client.
     */
    private static Options addHandleClientOptions() {
        Options options = new Options();
        options.addOption("h", "help", false, "Show help options.");
        // Mandatory option
        options.addOption("store", "storepath", true, "Path to the repository.");
        // Repository creation options
        options.addOption("crs", "createrepository", false, "Create a repository.");
        options.addOption("dp", "storedepth", true, "Depth of the repository.");
        options.addOption("wp", "storewidth", true, "Width of the repository.");
        options.addOption("ap", "storealgo", true, "Algorithm used to address objects.");
        // Object maintenance options
        options.addOption("createobject", "client_createobject", false, "Create an object.");
        options.addOption("putds", "client_putds", false, "Write a datastream from a file.");
        options.addOption("purgeds", "client_purgeds", false, "Purge a datastream.");
        options.addOption("listds", "client_listds", false, "List the datastreams of an object.");
        // Reconciliation options
        options.addOption(
            "ensure", "client_ensure", false,
            "Create the Handle if missing and attach it to the datastream given by -dsid.");
        options.addOption(
            "syncdc", "client_syncdc", false, "Write the Handle into the DC datastream.");
        options.addOption(
            "retract", "client_retract", false,
            "Delete the Handle if no associated datastream remains.");
        options.addOption("config", "handleconfig", true, "Path to handle.yaml.");
        options.addOption("pid", "pidguid", true, "PID of the object.");
        options.addOption("dsid", "datastream", true, "Datastream id.");
        options.addOption("path", "filepath", true, "Path to datastream content.");
        options.addOption("models", "contentmodels", true, "Comma separated content models.");
        return options;
    }

    /**
     * Create a new repository with the given properties.
     */
    private static void createNewRepository(
        Path storePath, String storeDepth, String storeWidth, String storeAlgorithm
    ) throws IOException, NoSuchAlgorithmException {
        Properties repositoryProperties = new Properties();
        repositoryProperties.setProperty(
            FileRepository.FileRepositoryProperties.repositoryPath.name(), storePath.toString());
        repositoryProperties.setProperty(
            FileRepository.FileRepositoryProperties.storeDepth.name(), storeDepth);
        repositoryProperties.setProperty(
            FileRepository.FileRepositoryProperties.storeWidth.name(), storeWidth);
        repositoryProperties.setProperty(
            FileRepository.FileRepositoryProperties.storeAlgorithm.name(), storeAlgorithm);
        repository = new FileRepository(repositoryProperties);
    }

    /**
     * Open an existing repository with the layout recorded in its 'repository.yaml'.
     *
     * @param storePath Path to repository
     * @throws IOException If 'repository.yaml' cannot be loaded
     */
    private static void initializeRepository(Path storePath) throws IOException,
        NoSuchAlgorithmException {
        HashMap<?, ?> layout = loadYaml(storePath.resolve(FileRepository.REPOSITORY_YAML));
        createNewRepository(
            storePath, String.valueOf(layout.get("store_depth")),
            String.valueOf(layout.get("store_width")),
            String.valueOf(layout.get("store_algorithm")));
    }

    /**
     * Build a reconciler from 'handle.yaml'
     *
     * @param configYaml Path to handle.yaml
     * @return Reconciler wired to the configured Handle service and associations
     * @throws HandleServiceFactoryException When the Handle service cannot be created
     * @throws IOException                   When handle.yaml cannot be read
     */
    private static HandleReconciler initializeReconciler(Path configYaml)
        throws HandleServiceFactoryException, IOException {
        HashMap<?, ?> config = loadYaml(configYaml);
        Properties serviceProperties = new Properties();
        setProperty(serviceProperties, HandleServiceProperties.handleServiceUrl,
                    config.get("handle_service_url"));
        setProperty(serviceProperties, HandleServiceProperties.handlePrefix,
                    config.get("handle_prefix"));
        setProperty(serviceProperties, HandleServiceProperties.handleUsername,
                    config.get("handle_username"));
        setProperty(serviceProperties, HandleServiceProperties.handlePassword,
                    config.get("handle_password"));
        setProperty(serviceProperties, HandleServiceProperties.targetUrlTemplate,
                    config.get("target_url_template"));
        setProperty(serviceProperties, HandleServiceProperties.handleServiceTimeout,
                    config.get("handle_service_timeout"));

        Object serviceClass = config.get("handle_service_class");
        HandleService handleService = HandleServiceFactory.getHandleService(
            serviceClass == null ? HandleServiceFactory.DEFAULT_HANDLE_SERVICE
                : serviceClass.toString(), serviceProperties);
        logClient.debug("Handle service initialized from: " + configYaml);
        return new HandleServiceReconciler(
            handleService, new YamlConfigurationStore(configYaml),
            new XsltHandleApplier(handleService));
    }

    private static void setProperty(
        Properties properties, HandleServiceProperties key, Object value) {
        if (value != null) {
            properties.setProperty(key.name(), value.toString());
        }
    }

    private static HashMap<?, ?> loadYaml(Path yamlPath) throws IOException {
        if (!Files.exists(yamlPath)) {
            throw new FileNotFoundException("HandleClient - Missing configuration: " + yamlPath);
        }
        File yamlFile = yamlPath.toFile();
        ObjectMapper om = new ObjectMapper(new YAMLFactory());
        HashMap<?, ?> values = om.readValue(yamlFile, HashMap.class);
        return values == null ? new HashMap<>() : values;
    }

    /**
     * Checks whether a given object is null and throws an exception if so
     *
     * @param object   Object to check
     * @param argument Value that is being checked
     * @throws IllegalArgumentException If the object is null
     */
    private static void ensureNotNull(Object object, String argument) {
        if (object == null) {
            String errMsg = "HandleClient - " + argument + " cannot be null";
            throw new IllegalArgumentException(errMsg);
        }
    }
}
