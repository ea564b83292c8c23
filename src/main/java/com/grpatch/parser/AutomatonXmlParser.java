package com.grpatch.parser;

import com.grpatch.model.Automaton;
import com.grpatch.model.AutomatonNode;
import com.grpatch.model.Valuation;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Reads automata in the tulipcon XML format. The root is either {@code <aut>} or a
 * {@code <tulipcon>} document containing one; namespaces are ignored. Nodes carry an
 * {@code <id>}, a {@code <child_list>} of successor ids, a {@code <state>} of
 * {@code <item key=".." value=".."/>} entries and, in the annotated format, an {@code <anno>}
 * element holding mode and rgrad.
 */
public final class AutomatonXmlParser {
  private static final Logger log = Logger.getLogger(AutomatonXmlParser.class.getName());

  private AutomatonXmlParser() {}

  public static Automaton parse(String xml) {
    Document document;
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      // gr1c output never carries a DOCTYPE; reject it to keep external entities out
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      factory.setNamespaceAware(true);
      factory.setIgnoringComments(true);
      factory.setCoalescing(true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      document = builder.parse(new InputSource(new StringReader(xml)));
    } catch (SAXException | IOException e) {
      throw new IllegalArgumentException("Malformed automaton XML", e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException(e);
    }

    Element root = document.getDocumentElement();
    Element aut = "aut".equals(localName(root)) ? root : child(root, "aut");
    if (aut == null) {
      throw new IllegalArgumentException("No <aut> element in document with root <%s>".formatted(localName(root)));
    }

    Automaton automaton = new Automaton();
    for (Element node : children(aut, "node")) {
      int id = ParseUtil.parseInt(requireChild(node, "id", "node").getTextContent().trim(), "node id");
      if (automaton.contains(id)) {
        log.log(Level.WARNING, () -> "Duplicate node %d, ignoring".formatted(id));
        continue;
      }
      IntList successors = new IntArrayList();
      Element childList = child(node, "child_list");
      if (childList != null) {
        String text = childList.getTextContent().trim();
        if (!text.isEmpty()) {
          for (String successor : text.split("\\s+")) {
            successors.add(ParseUtil.parseInt(successor, "successor of node " + id));
          }
        }
      }

      Valuation.Builder state = Valuation.builder();
      for (Element item : children(requireChild(node, "state", "node " + id), "item")) {
        String key = item.getAttribute("key");
        if (key.isEmpty()) {
          throw new IllegalArgumentException("State item without key in node " + id);
        }
        state.put(key, ParseUtil.parseInt(item.getAttribute("value"), "value of " + key + " in node " + id));
      }

      int mode = AutomatonNode.UNSET;
      int rgrad = AutomatonNode.UNSET;
      Element anno = child(node, "anno");
      if (anno != null && !anno.getTextContent().isBlank()) {
        String[] values = anno.getTextContent().trim().split("\\s+");
        if (values.length != 2) {
          throw new IllegalArgumentException("Annotation of node %d must hold mode and rgrad".formatted(id));
        }
        mode = ParseUtil.parseInt(values[0], "mode of node " + id);
        rgrad = ParseUtil.parseInt(values[1], "rgrad of node " + id);
      }
      automaton.addNode(id, state.build(), successors, mode, rgrad);
    }
    automaton.validate();
    return automaton;
  }

  private static String localName(Node node) {
    return node.getLocalName() == null ? node.getNodeName() : node.getLocalName();
  }

  private static List<Element> children(Element parent, String name) {
    List<Element> elements = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      if (nodes.item(i) instanceof Element element && name.equals(localName(element))) {
        elements.add(element);
      }
    }
    return elements;
  }

  @Nullable
  private static Element child(Element parent, String name) {
    List<Element> elements = children(parent, name);
    return elements.isEmpty() ? null : elements.get(0);
  }

  private static Element requireChild(Element parent, String name, String context) {
    Element element = child(parent, name);
    if (element == null) {
      throw new IllegalArgumentException("Missing <%s> in %s".formatted(name, context));
    }
    return element;
  }
}
