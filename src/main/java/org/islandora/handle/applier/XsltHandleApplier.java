package org.islandora.handle.applier;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import javax.xml.XMLConstants;
import javax.xml.transform.Templates;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.Message;
import org.islandora.handle.filerepository.FileRepositoryUtility;
import org.islandora.handle.repository.RepositoryObject;
import org.islandora.handle.service.HandleService;

/**
 * XsltHandleApplier embeds a Handle by running the datastream through an XSLT stylesheet that
 * receives the canonical Handle URL as the `handle_value` parameter. The configured transform is
 * looked up on the file system first and then on the classpath, where the bundled
 * `xsl/add_handle_identifier_mods.xsl` lives. Compiled stylesheets are cached per transform.
 */
public class XsltHandleApplier implements HandleApplier {
    private static final Log logApplier = LogFactory.getLog(XsltHandleApplier.class);
    private final HandleService handleService;
    private final Map<String, Templates> compiledTransforms = new ConcurrentHashMap<>();

    public static final String HANDLE_PARAMETER = "handle_value";

    public XsltHandleApplier(HandleService handleService) {
        FileRepositoryUtility.ensureNotNull(handleService, "handleService", "XsltHandleApplier");
        this.handleService = handleService;
    }

    @Override
    public AttachmentResult applyHandleToDatastream(
        RepositoryObject object, String dsid, String transform) {
        FileRepositoryUtility.ensureNotNull(object, "object", "applyHandleToDatastream");
        FileRepositoryUtility.ensureNotNull(dsid, "dsid", "applyHandleToDatastream");
        FileRepositoryUtility.ensureNotNull(transform, "transform", "applyHandleToDatastream");
        String pid = object.getId();
        String handleUrl = handleService.canonicalUrl(pid);

        try {
            Templates templates = getTemplates(transform);
            if (templates == null) {
                logApplier.error(
                    "Transform: " + transform + " not found for " + dsid + " on " + pid);
                return new AttachmentResult(false, Message.logError(
                    "Unable to find the transform {transform} configured for the {dsid}"
                        + " datastream of {pid}.",
                    Map.of("transform", transform, "dsid", dsid, "pid", pid)));
            }

            byte[] content = object.getDatastreamContent(dsid);
            Transformer transformer = templates.newTransformer();
            transformer.setParameter(HANDLE_PARAMETER, handleUrl);
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            transformer.transform(
                new StreamSource(new ByteArrayInputStream(content)), new StreamResult(output));
            byte[] transformed = output.toByteArray();

            if (Arrays.equals(content, transformed)) {
                logApplier.debug("Handle already present in " + dsid + " for pid: " + pid);
            } else {
                object.setDatastreamContent(dsid, transformed);
                logApplier.info("Handle: " + handleUrl + " appended to " + dsid + " for: " + pid);
            }
            return new AttachmentResult(true, Message.notice(
                "Appended the Handle {handle} to the {dsid} datastream of {pid}.",
                Map.of("handle", handleUrl, "dsid", dsid, "pid", pid)));

        } catch (IOException | TransformerException e) {
            logApplier.error(
                "Unable to append Handle to " + dsid + " for pid: " + pid + ". Exception: "
                    + e.getMessage());
            return new AttachmentResult(false, Message.logError(
                "Unable to append the Handle to the {dsid} datastream of {pid}: {error}",
                Map.of("dsid", dsid, "pid", pid, "error", String.valueOf(e.getMessage()))));
        }
    }

    /**
     * Compile, or fetch from the cache, the stylesheet named by a transform.
     *
     * @param transform File system path or classpath resource of the stylesheet
     * @return Compiled stylesheet, null if it cannot be found
     * @throws IOException          When the stylesheet cannot be read
     * @throws TransformerException When the stylesheet does not compile
     */
    protected Templates getTemplates(String transform) throws IOException, TransformerException {
        Templates cached = compiledTransforms.get(transform);
        if (cached != null) {
            return cached;
        }
        TransformerFactory factory = TransformerFactory.newInstance();
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);

        Templates templates;
        Path transformPath = Paths.get(transform);
        if (Files.isRegularFile(transformPath)) {
            templates = factory.newTemplates(new StreamSource(transformPath.toFile()));
        } else {
            URL resource = XsltHandleApplier.class.getClassLoader().getResource(transform);
            if (resource == null) {
                return null;
            }
            try (InputStream stylesheet = resource.openStream()) {
                templates = factory.newTemplates(
                    new StreamSource(stylesheet, resource.toExternalForm()));
            }
        }
        compiledTransforms.put(transform, templates);
        logApplier.debug("Compiled transform: " + transform);
        return templates;
    }
}
