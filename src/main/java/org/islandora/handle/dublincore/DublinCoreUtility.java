package org.islandora.handle.dublincore;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.islandora.handle.service.HandleService;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * DublinCoreUtility edits the `dc:identifier` elements of an OAI Dublin Core document. Documents
 * are parsed namespace aware with whitespace-only text dropped, and serialized indented, so that
 * a document written by this class reads back and writes out identically.
 */
public class DublinCoreUtility {
    private static final Log logDublinCore = LogFactory.getLog(DublinCoreUtility.class);

    public static final String OAI_DC_NAMESPACE = "http://www.openarchives.org/OAI/2.0/oai_dc/";
    public static final String DC_NAMESPACE = "http://purl.org/dc/elements/1.1/";
    public static final String IDENTIFIER_QUERY = "//dc:identifier";
    public static final String DISALLOW_DOCTYPE_FEATURE =
        "http://apache.org/xml/features/disallow-doctype-decl";

    private static final NamespaceContext DC_NAMESPACES = new NamespaceContext() {
        @Override
        public String getNamespaceURI(String prefix) {
            if ("oai_dc".equals(prefix)) {
                return OAI_DC_NAMESPACE;
            } else if ("dc".equals(prefix)) {
                return DC_NAMESPACE;
            }
            return XMLConstants.NULL_NS_URI;
        }

        @Override
        public String getPrefix(String namespaceUri) {
            if (OAI_DC_NAMESPACE.equals(namespaceUri)) {
                return "oai_dc";
            } else if (DC_NAMESPACE.equals(namespaceUri)) {
                return "dc";
            }
            return null;
        }

        @Override
        public Iterator<String> getPrefixes(String namespaceUri) {
            String prefix = getPrefix(namespaceUri);
            return prefix == null ? List.<String>of().iterator() : List.of(prefix).iterator();
        }
    };

    /**
     * Parse a Dublin Core datastream.
     *
     * @param content Datastream content
     * @return Parsed document without whitespace-only text nodes
     * @throws IOException When the content is not well-formed XML or declares a DOCTYPE
     */
    public static Document parse(byte[] content) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature(DISALLOW_DOCTYPE_FEATURE, true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document document = builder.parse(new ByteArrayInputStream(content));
            removeWhitespaceNodes(document.getDocumentElement());
            return document;

        } catch (ParserConfigurationException | SAXException e) {
            String errMsg = "Unable to parse Dublin Core document: " + e.getMessage();
            logDublinCore.error(errMsg);
            throw new IOException(errMsg, e);
        }
    }

    /**
     * Serialize a document, indented, as UTF-8.
     *
     * @param document Document to serialize
     * @return Serialized document
     * @throws IOException When the document cannot be serialized
     */
    public static byte[] serialize(Document document) throws IOException {
        try {
            document.setXmlStandalone(true);
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(document), new StreamResult(output));
            return output.toByteArray();

        } catch (TransformerException te) {
            String errMsg = "Unable to serialize Dublin Core document: " + te.getMessage();
            logDublinCore.error(errMsg);
            throw new IOException(errMsg, te);
        }
    }

    /**
     * @param document Dublin Core document
     * @return Every `dc:identifier` element, in document order
     * @throws IOException When the document cannot be searched
     */
    public static List<Element> findIdentifiers(Document document) throws IOException {
        XPath xpath = XPathFactory.newInstance().newXPath();
        xpath.setNamespaceContext(DC_NAMESPACES);
        List<Element> identifiers = new ArrayList<>();
        try {
            NodeList nodes = (NodeList) xpath.evaluate(
                IDENTIFIER_QUERY, document, XPathConstants.NODESET);
            for (int i = 0; i < nodes.getLength(); i++) {
                identifiers.add((Element) nodes.item(i));
            }

        } catch (XPathExpressionException xpee) {
            String errMsg = "Unable to search Dublin Core document for identifiers: "
                + xpee.getMessage();
            logDublinCore.error(errMsg);
            throw new IOException(errMsg, xpee);
        }
        return identifiers;
    }

    /**
     * @param text Text of a `dc:identifier`
     * @return True if the text is a Handle resolver URL
     */
    public static boolean isHandleIdentifier(String text) {
        return text != null && text.startsWith(HandleService.HANDLE_RESOLVER_URL);
    }

    /**
     * Make the document carry the given Handle URL. The first identifier holding a Handle URL is
     * replaced in place by a new identifier when its text differs from `handleUrl`; later Handle
     * identifiers are left alone. When there is none, a new identifier is appended as the last
     * child of the root element.
     *
     * @param document  Dublin Core document, edited in place
     * @param handleUrl Canonical Handle URL
     * @return True if the document was changed
     * @throws IOException When the document cannot be searched
     */
    public static boolean syncHandleIdentifier(Document document, String handleUrl)
        throws IOException {
        for (Element identifier : findIdentifiers(document)) {
            if (!isHandleIdentifier(identifier.getTextContent())) {
                continue;
            }
            if (handleUrl.equals(identifier.getTextContent())) {
                logDublinCore.debug("Handle identifier already up to date: " + handleUrl);
                return false;
            }
            logDublinCore.debug(
                "Replacing Handle identifier: " + identifier.getTextContent() + " with: "
                    + handleUrl);
            Node parent = identifier.getParentNode();
            parent.insertBefore(newIdentifier(document, handleUrl), identifier);
            parent.removeChild(identifier);
            return true;
        }

        logDublinCore.debug("Appending Handle identifier: " + handleUrl);
        document.getDocumentElement().appendChild(newIdentifier(document, handleUrl));
        return true;
    }

    /**
     * Remove every identifier whose text equals the given Handle URL.
     *
     * @param document  Dublin Core document, edited in place
     * @param handleUrl Canonical Handle URL
     * @return Number of identifiers removed
     * @throws IOException When the document cannot be searched
     */
    public static int removeHandleIdentifier(Document document, String handleUrl)
        throws IOException {
        int removed = 0;
        for (Element identifier : findIdentifiers(document)) {
            if (handleUrl.equals(identifier.getTextContent())) {
                identifier.getParentNode().removeChild(identifier);
                removed++;
            }
        }
        logDublinCore.debug("Removed " + removed + " Handle identifiers matching: " + handleUrl);
        return removed;
    }

    private static Element newIdentifier(Document document, String handleUrl) {
        Element identifier = document.createElementNS(DC_NAMESPACE, "dc:identifier");
        identifier.setTextContent(handleUrl);
        return identifier;
    }

    /**
     * Drop text nodes that hold nothing but whitespace, so the serializer controls indentation.
     */
    private static void removeWhitespaceNodes(Node node) {
        NodeList children = node.getChildNodes();
        for (int i = children.getLength() - 1; i >= 0; i--) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE && child.getTextContent().trim().isEmpty()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeWhitespaceNodes(child);
            }
        }
    }
}
