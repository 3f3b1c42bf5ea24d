package org.bpmnml.generator;

import org.w3c.dom.Document;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes generated BPMN documents.
 */
public final class BpmnDocumentWriter {
    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private BpmnDocumentWriter() {
    }

    /**
     * Converts the document to text.
     *
     * @param doc     the document to serialize
     * @param options indentation settings
     * @return the XML text, starting with a fixed UTF-8 declaration and ending with a newline
     * @throws RuntimeException if the transformation fails
     */
    public static String toXml(Document doc, GeneratorOptions options) {
        try {
            TransformerFactory transformerFactory = TransformerFactory.newInstance();
            Transformer transformer = transformerFactory.newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            // the declaration is written by hand so it does not depend on the transformer implementation
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            if (options.prettify()) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount",
                        String.valueOf(options.indent()));
            } else {
                transformer.setOutputProperty(OutputKeys.INDENT, "no");
            }

            StringWriter stringWriter = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(stringWriter));

            // Remove extra blank lines (consecutive newlines)
            String xmlContent = stringWriter.toString().replaceAll("(\r?\n)\\s*\r?\n", "$1").strip();
            return XML_DECLARATION + xmlContent + "\n";
        } catch (TransformerException e) {
            throw new RuntimeException("Failed to serialize BPMN document", e);
        }
    }

    /**
     * Writes the XML text to a file, creating parent directories as needed.
     *
     * @throws RuntimeException if the file cannot be written
     */
    public static void writeXml(String xml, Path outputFile) {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write BPMN file: " + outputFile, e);
        }
    }
}
