package com.chemked.data.respecth;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

/** DOM plumbing shared by the ReSpecTh reader and writer. */
final class ReSpecThXml {

    static final String ROOT_ELEMENT = "experiment";

    private ReSpecThXml() {}

    static Document parse(InputStream in, String sourceName) throws IOException, ConversionException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(in, sourceName);
        } catch (SAXException ex) {
            throw new ConversionException(sourceName, "not well-formed XML: " + ex.getMessage(), ex);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser unavailable", ex);
        }
    }

    static Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser unavailable", ex);
        }
    }

    static void write(Document document, OutputStream out) throws IOException {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.transform(new DOMSource(document), new StreamResult(out));
        } catch (TransformerException ex) {
            throw new IOException("Unable to write ReSpecTh XML: " + ex.getMessage(), ex);
        }
    }

    static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && (name == null || name.equals(element.getTagName()))) {
                result.add(element);
            }
        }
        return result;
    }

    static List<Element> children(Element parent) {
        return children(parent, null);
    }

    static Optional<Element> child(Element parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && name.equals(element.getTagName())) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /** Trimmed text of the named child, empty when the child is missing or blank. */
    static Optional<String> childText(Element parent, String name) {
        return child(parent, name).map(ReSpecThXml::text).filter(text -> !text.isEmpty());
    }

    static String text(Element element) {
        return element.getTextContent() == null ? "" : element.getTextContent().strip();
    }

    /** Attribute value, empty when the attribute is absent. */
    static Optional<String> attribute(Element element, String name) {
        return element.hasAttribute(name) ? Optional.of(element.getAttribute(name)) : Optional.empty();
    }

    /** Slash-separated path from the root with one-based indexes among same-named siblings. */
    static String path(Element element) {
        StringBuilder path = new StringBuilder();
        Node node = element;
        while (node instanceof Element current) {
            String segment = current.getTagName();
            Node parent = current.getParentNode();
            if (parent instanceof Element parentElement) {
                List<Element> siblings = children(parentElement, current.getTagName());
                if (siblings.size() > 1) {
                    segment += "[" + (siblings.indexOf(current) + 1) + "]";
                }
            }
            path.insert(0, path.length() == 0 ? segment : segment + "/");
            node = parent;
        }
        return path.toString();
    }

    static Element append(Element parent, String name) {
        Element element = parent.getOwnerDocument().createElement(name);
        parent.appendChild(element);
        return element;
    }

    static Element append(Element parent, String name, String text) {
        Element element = append(parent, name);
        element.setTextContent(text);
        return element;
    }
}
