package com.chaineditor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * A node parameter value: either a literal JSON value or a back-reference to the
 * output of the preceding node.
 *
 * On the wire both are plain JSON; a reference travels as a single token string
 * (see {@link com.chaineditor.chain.ReferenceToken}).
 */
@JsonSerialize(using = ParameterValueJson.Serializer.class)
@JsonDeserialize(using = ParameterValueJson.Deserializer.class)
public abstract class ParameterValue {

    ParameterValue() {
    }

    public static Literal literal(JsonNode value) {
        return new Literal(value);
    }

    public static Literal text(String value) {
        return new Literal(JsonNodeFactory.instance.textNode(value));
    }

    public static Reference reference(String nodeName, String pathSuffix) {
        return new Reference(nodeName, pathSuffix, '\'');
    }

    public abstract boolean isReference();

    @JsonSerialize(using = ParameterValueJson.Serializer.class)
    public static final class Literal extends ParameterValue {
        private final JsonNode value;

        public Literal(JsonNode value) {
            this.value = value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy();
        }

        public JsonNode getValue() {
            return value.deepCopy();
        }

        @Override
        public boolean isReference() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Literal)) return false;
            return value.equals(((Literal) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Literal{" + value + '}';
        }
    }

    /**
     * Reference to a node by name plus the path into its output, e.g. {@code .output}.
     * The quote character is remembered so a rewrite only ever touches the name.
     */
    @JsonSerialize(using = ParameterValueJson.Serializer.class)
    public static final class Reference extends ParameterValue {
        private final String nodeName;
        private final String pathSuffix;
        private final char quote;

        public Reference(String nodeName, String pathSuffix, char quote) {
            this.nodeName = nodeName == null ? "" : nodeName;
            this.pathSuffix = pathSuffix == null ? "" : pathSuffix;
            if (quote != '\'' && quote != '"') {
                throw new IllegalArgumentException("Unsupported quote character: " + quote);
            }
            this.quote = quote;
        }

        public String getNodeName() {
            return nodeName;
        }

        public String getPathSuffix() {
            return pathSuffix;
        }

        public char getQuote() {
            return quote;
        }

        public Reference withNodeName(String newName) {
            if (Objects.equals(nodeName, newName)) {
                return this;
            }
            return new Reference(newName, pathSuffix, quote);
        }

        @Override
        public boolean isReference() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Reference)) return false;
            Reference other = (Reference) o;
            return quote == other.quote
                && nodeName.equals(other.nodeName)
                && pathSuffix.equals(other.pathSuffix);
        }

        @Override
        public int hashCode() {
            return Objects.hash(nodeName, pathSuffix, quote);
        }

        @Override
        public String toString() {
            return "Reference{" +
                "nodeName='" + nodeName + '\'' +
                ", pathSuffix='" + pathSuffix + '\'' +
                '}';
        }
    }
}
