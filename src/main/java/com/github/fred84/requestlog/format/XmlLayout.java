package com.github.fred84.requestlog.format;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
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

/**
 * Renders a record as an indented {@code <log>} element. Maps become nested elements, lists become
 * {@code item_N} children. Names that are not valid XML names get their offending characters replaced.
 */
public class XmlLayout extends StructuredLayout {

    static final String ROOT = "log";

    private final DocumentBuilderFactory documentBuilderFactory = DocumentBuilderFactory.newInstance();
    private final TransformerFactory transformerFactory = TransformerFactory.newInstance();

    public XmlLayout() {
    }

    public XmlLayout(String template) {
        super(template);
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        try {
            Document document = documentBuilder().newDocument();
            Element root = document.createElement(ROOT);
            document.appendChild(root);

            for (String field : getFields()) {
                Object value = resolve(event, field);
                if (value != null && !"".equals(value)) {
                    root.appendChild(element(document, field, stringify(value)));
                }
            }

            String exception = exceptionText(event);
            if (exception != null) {
                root.appendChild(element(document, EXCEPTION, exception));
            }

            return write(document) + CoreConstants.LINE_SEPARATOR;
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IllegalStateException("unable to render log record as xml", e);
        }
    }

    private static Element element(Document document, String name, Object value) {
        Element element = document.createElement(elementName(name));

        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((k, v) -> element.appendChild(element(document, String.valueOf(k), v)));
        } else if (value instanceof List) {
            List<?> items = (List<?>) value;
            for (int i = 0; i < items.size(); i++) {
                element.appendChild(element(document, "item_" + i, items.get(i)));
            }
        } else {
            element.setTextContent(String.valueOf(value));
        }
        return element;
    }

    static String elementName(String name) {
        StringBuilder result = new StringBuilder(name.length() + 1);
        for (char c : name.toCharArray()) {
            boolean valid = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
            result.append(valid ? c : '_');
        }
        if (result.length() == 0 || !(Character.isLetter(result.charAt(0)) || result.charAt(0) == '_')) {
            result.insert(0, '_');
        }
        return result.toString();
    }

    private DocumentBuilder documentBuilder() throws ParserConfigurationException {
        synchronized (documentBuilderFactory) {
            return documentBuilderFactory.newDocumentBuilder();
        }
    }

    private String write(Document document) throws TransformerException {
        Transformer transformer;
        synchronized (transformerFactory) {
            transformer = transformerFactory.newTransformer();
        }
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

        StringWriter writer = new StringWriter();
        transformer.transform(new DOMSource(document), new StreamResult(writer));
        return writer.toString().trim();
    }

    @Override
    public String getContentType() {
        return "text/xml";
    }
}
