package factstore.core.store;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.sparql.core.Var;

import factstore.core.triple.Primitives;
import factstore.core.triple.Triple;

/**
 * Maps triples to and from the RDF terms stored in a Jena model.
 * Every value becomes an IRI in the {@code em:} scheme so a value bound in the
 * object slot of one pattern can join with the id slot of another.
 * Variables become SPARQL variables named without the {@code ?} prefix.
 */
final class FactEncoding {

    static final String DEFAULT_URN_START = "em:";

    private FactEncoding() {}

    static String toUri(String value) {
        return DEFAULT_URN_START + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static String fromUri(String uri) {
        if (!uri.startsWith(DEFAULT_URN_START)) {
            return uri;
        }
        return URLDecoder.decode(uri.substring(DEFAULT_URN_START.length()), StandardCharsets.UTF_8);
    }

    static Node toNode(String primitive) {
        if (Primitives.isVariable(primitive)) {
            return Var.alloc(Primitives.variableName(primitive));
        }
        return NodeFactory.createURI(toUri(primitive));
    }

    /**
     * Pattern for a basic graph pattern block.
     */
    static org.apache.jena.graph.Triple toPattern(Triple triple) {
        return org.apache.jena.graph.Triple.create(
            toNode(triple.id), toNode(triple.predicate), toNode(triple.object));
    }

    /**
     * Statement for a concrete fact.
     */
    static Statement toStatement(Model model, Triple fact) {
        return model.createStatement(
            model.createResource(toUri(fact.id)),
            model.createProperty(toUri(fact.predicate)),
            model.createResource(toUri(fact.object)));
    }

    /**
     * Value of a solution term. Literals loaded from elsewhere are read by lexical form.
     */
    static String fromNode(RDFNode node) {
        String value;
        if (node.isURIResource()) {
            value = fromUri(node.asResource().getURI());
        } else if (node.isLiteral()) {
            value = node.asLiteral().getLexicalForm();
        } else {
            value = node.toString();
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
