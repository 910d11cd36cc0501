package org.forcecom.restapi.rest.parser;

import org.apache.commons.lang3.StringUtils;
import org.forcecom.restapi.model.QueryPage;
import org.forcecom.restapi.model.QueryRecord;
import org.forcecom.restapi.model.ServiceError;
import org.forcecom.restapi.rest.FieldTextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses XML query responses into {@link QueryPage}s.
 *
 * <p>Expected shape (children of the document root):</p>
 * <pre>{@code
 * <QueryResult>
 *   <done>false</done>
 *   <nextRecordsUrl>/services/data/v35.0/query/01gD0000002HU6KIAW-2000</nextRecordsUrl>
 *   <records type="Account" url="...">
 *     <Id>001D000000IqhSLIAZ</Id>
 *     <Owner type="User"><Name>Jane</Name></Owner>
 *   </records>
 *   <totalSize>2500</totalSize>
 * </QueryResult>
 * }</pre>
 *
 * <p>Error responses carry {@code <Error><errorCode/><message/></Error>} under the root. When both
 * children are non-empty the page holds only the error; records and continuation are not read.</p>
 */
public class XmlQueryPageParser implements ResponseParser<QueryPage> {

    private static final Logger logger = LoggerFactory.getLogger(XmlQueryPageParser.class);

    private static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    private final FieldTextNormalizer normalizer;

    public XmlQueryPageParser(FieldTextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public QueryPage parse(String httpResponse) throws ParseException {
        Element root = parseDocument(httpResponse).getDocumentElement();

        ServiceError error = readError(root);
        if (error != null) {
            return QueryPage.builder().error(error).build();
        }

        List<QueryRecord> records = new ArrayList<>();
        for (Element recordElement : childElements(root, "records")) {
            Map<String, String> fields = new LinkedHashMap<>();
            collectFields(recordElement, "", fields);
            records.add(new QueryRecord(fields));
        }

        return QueryPage.builder()
                .records(records)
                .nextRecordsUrl(StringUtils.trimToNull(normalizer.normalize("nextRecordsUrl", childText(root, "nextRecordsUrl"))))
                .totalSize(parseTotalSize(childText(root, "totalSize")))
                .done(Boolean.parseBoolean(StringUtils.trim(childText(root, "done"))))
                .build();
    }

    @Override
    public String getName() {
        return "XmlQueryPageParser";
    }

    /**
     * Reads {@code Error/errorCode} and {@code Error/message}. A partial error node (one of the two
     * missing or empty) is not treated as an error.
     */
    private ServiceError readError(Element root) {
        List<Element> errorElements = childElements(root, "Error");
        if (errorElements.isEmpty()) {
            return null;
        }
        Element errorElement = errorElements.get(0);
        String errorCode = StringUtils.trimToNull(normalizer.normalize("errorCode", childText(errorElement, "errorCode")));
        String message = StringUtils.trimToNull(normalizer.normalize("message", childText(errorElement, "message")));
        if (errorCode == null || message == null) {
            logger.warn("Ignoring incomplete Error node (errorCode={}, message={})", errorCode, message);
            return null;
        }
        return new ServiceError(errorCode, message);
    }

    /**
     * Flattens the children of a record element. Nested elements become dotted names,
     * {@code xsi:nil} elements become null, the first occurrence of a repeated name wins.
     */
    private void collectFields(Element element, String prefix, Map<String, String> fields) {
        for (Element child : childElements(element, null)) {
            String name = prefix + localName(child);
            if (hasChildElements(child)) {
                collectFields(child, name + ".", fields);
            } else if (!fields.containsKey(name)) {
                fields.put(name, isNil(child) ? null : normalizer.normalize(name, child.getTextContent()));
            }
        }
    }

    private Integer parseTotalSize(String text) throws ParseException {
        String value = StringUtils.trimToNull(text);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new ParseException("totalSize is not a number: " + value, e);
        }
    }

    private Document parseDocument(String httpResponse) throws ParseException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new InputSource(new StringReader(httpResponse)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ParseException("Failed to parse XML response: " + e.getMessage(), e);
        }
    }

    private static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE
                    && (localName == null || localName.equals(localName(child)))) {
                result.add((Element) child);
            }
        }
        return result;
    }

    private static String childText(Element parent, String localName) {
        List<Element> matches = childElements(parent, localName);
        return matches.isEmpty() ? null : matches.get(0).getTextContent();
    }

    private static boolean hasChildElements(Element element) {
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i).getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNil(Element element) {
        return "true".equals(element.getAttributeNS(XSI_NAMESPACE, "nil"));
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    /** Keeps the parser from printing to stderr; fatal errors still abort parsing. */
    private static final class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            logger.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
