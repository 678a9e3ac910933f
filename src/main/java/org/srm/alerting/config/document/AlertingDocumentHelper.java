package org.srm.alerting.config.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads and saves alerting configuration documents.
 * A document is parsed once, mutated in memory and written once at the end of a run.
 */
public class AlertingDocumentHelper {
    private static final Logger log = LoggerFactory.getLogger(AlertingDocumentHelper.class);

    public static AlertingDocument parse(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (MalformedDocumentException e) {
            throw e;
        } catch (Exception e) {
            throw new MalformedDocumentException("Failed to read alerting document: " + path, e);
        }
    }

    public static AlertingDocument parse(InputStream in, String source) {
        return parse(new InputSource(in), source);
    }

    public static AlertingDocument parseString(String xml) {
        return parse(new InputSource(new StringReader(xml)), "<string>");
    }

    private static AlertingDocument parse(InputSource input, String source) {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(input);
        } catch (Exception e) {
            throw new MalformedDocumentException("Failed to parse alerting document: " + source, e);
        }

        Element root = doc.getDocumentElement();
        if (!AlertingDocument.ROOT_TAG.equals(NodeHelper.localName(root))) {
            throw new MalformedDocumentException("Root element of " + source + " is '"
                    + NodeHelper.localName(root) + "', expected '" + AlertingDocument.ROOT_TAG + "'");
        }

        log.debug("Loaded alerting document {}", source);
        return new AlertingDocument(doc, root, source);
    }

    private static DocumentBuilder newDocumentBuilder() throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        return factory.newDocumentBuilder();
    }

    /**
     * Serializes the document without re-indenting it, so untouched parts keep their original layout.
     */
    public static String toXml(AlertingDocument document) {
        try {
            Document doc = document.dom();
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            transformer.setOutputProperty(OutputKeys.STANDALONE, doc.getXmlStandalone() ? "yes" : "no");

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

            String xmlContent = stringWriter.toString();
            if (!doc.getXmlStandalone()) {
                xmlContent = xmlContent.replaceFirst(" standalone=\"no\"", "");
            }
            // The JDK serializer does not break the line after the declaration
            return xmlContent.replaceFirst("^(<\\?xml[^>]*\\?>)(?!\\r?\\n)", "$1\n");
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize alerting document: " + document.source(), e);
        }
    }

    public static void write(AlertingDocument document, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(outputPath, toXml(document).getBytes(StandardCharsets.UTF_8));
            log.info("Wrote alerting document {}", outputPath);
        } catch (Exception e) {
            throw new RuntimeException("Failed to write alerting document: " + outputPath, e);
        }
    }
}
