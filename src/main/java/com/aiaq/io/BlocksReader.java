package com.aiaq.io;

import com.aiaq.model.BlockDescriptor;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads Blockly XML blocks files. Elements may be unqualified or in the XHTML namespace; only local names matter.
 */
public class BlocksReader {
    private static final Logger log = LoggerFactory.getLogger(BlocksReader.class);

    public BlocksDocument read(InputStream input) throws IOException {
        byte[] content = input.readAllBytes();
        if (new String(content, StandardCharsets.UTF_8).isBlank()) {
            return BlocksDocument.empty();
        }
        Element root = parse(content).getDocumentElement();
        Integer languageVersion = null;
        Integer yaVersion = null;
        MutableList<BlockDescriptor> blocks = Lists.mutable.empty();
        for (Element child : elements(root)) {
            String name = child.getLocalName();
            if ("yacodeblocks".equals(name)) {
                languageVersion = intAttribute(child, "language-version");
                yaVersion = intAttribute(child, "ya-version");
            } else if ("block".equals(name)) {
                blocks.add(readBlock(child));
            } else {
                log.warn("Skipping <{}> at top level of blocks file", name);
            }
        }
        return new BlocksDocument(languageVersion, yaVersion, blocks.asUnmodifiable());
    }

    public BlocksDocument read(String content) throws IOException {
        return read(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }

    private BlockDescriptor readBlock(Element element) throws IOException {
        String type = element.getAttribute("type");
        if (type.isEmpty()) {
            throw new IOException("Block element without a type");
        }
        BlockDescriptor.Builder builder = BlockDescriptor.builder(type)
                .id(optionalAttribute(element, "id"))
                .inline("true".equals(element.getAttribute("inline")))
                .disabled("true".equals(element.getAttribute("disabled")));
        if (element.hasAttribute("x") && element.hasAttribute("y")) {
            builder.position(intAttribute(element, "x"), intAttribute(element, "y"));
        }
        for (Element child : elements(element)) {
            String name = child.getLocalName();
            switch (name) {
                case "mutation" -> builder.mutation(attributes(child));
                case "comment" -> builder.comment(child.getTextContent());
                case "field", "title" -> builder.field(child.getAttribute("name"), child.getTextContent());
                case "value" -> {
                    Element plugged = firstBlock(child);
                    if (plugged != null) {
                        builder.value(child.getAttribute("name"), readBlock(plugged));
                    }
                }
                case "statement" -> {
                    Element plugged = firstBlock(child);
                    if (plugged != null) {
                        builder.statement(child.getAttribute("name"), readBlock(plugged));
                    }
                }
                case "next" -> {
                    Element plugged = firstBlock(child);
                    if (plugged != null) {
                        builder.next(readBlock(plugged));
                    }
                }
                default -> log.warn("Skipping <{}> in block {} of type {}", name, element.getAttribute("id"), type);
            }
        }
        return builder.build();
    }

    private Element firstBlock(Element connection) {
        for (Element child : elements(connection)) {
            if ("block".equals(child.getLocalName())) {
                return child;
            }
            // shadow blocks are placeholders in the editor
            log.debug("Ignoring <{}> inside <{}>", child.getLocalName(), connection.getLocalName());
        }
        return null;
    }

    private static Document parse(byte[] content) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(content));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Malformed blocks file: " + e.getMessage(), e);
        }
    }

    private static MutableList<Element> elements(Element parent) {
        MutableList<Element> result = Lists.mutable.empty();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Map<String, String> attributes(Element element) {
        Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i < element.getAttributes().getLength(); i++) {
            Node attribute = element.getAttributes().item(i);
            if (!"xmlns".equals(attribute.getNodeName()) && !attribute.getNodeName().startsWith("xmlns:")) {
                result.put(attribute.getNodeName(), attribute.getNodeValue());
            }
        }
        return result;
    }

    private static String optionalAttribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static Integer intAttribute(Element element, String name) throws IOException {
        if (!element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name).trim();
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            // positions are saved as floats by some editor versions
            try {
                return (int) Double.parseDouble(value);
            } catch (NumberFormatException nested) {
                throw new IOException("Invalid " + name + " attribute: " + value, nested);
            }
        }
    }
}
