package com.luaparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.luaparser.ast.SyntaxNodeOrToken;
import com.luaparser.jackson.mixins.SyntaxMixin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the syntax tree.
 *
 * This module handles:
 * - Polymorphic type handling via SyntaxMixin, with each record registered under its simple name
 * - A "kind" property on every element
 * - Dropping derived properties (leaf, token) that are not part of the wire format
 */
public class AstModule extends SimpleModule {

    // isLeaf()/isToken() are picked up as bean properties but are computed from children
    private static final Set<String> EXCLUDED_FIELDS = Set.of("leaf", "token");

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.luaparser", "luasyntax-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixin goes on every interface and record: mixin inheritance from
        // interfaces is not reliable for records
        for (Class<?> type : syntaxTypes()) {
            context.setMixInAnnotations(type, SyntaxMixin.class);
            if (type.isRecord()) {
                context.registerSubtypes(new NamedType(type, type.getSimpleName()));
            }
        }

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    /**
     * Walks the sealed hierarchy under {@link SyntaxNodeOrToken}: every category
     * interface and every record, parents before children.
     */
    static List<Class<?>> syntaxTypes() {
        Set<Class<?>> types = new LinkedHashSet<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.add(SyntaxNodeOrToken.class);
        while (!pending.isEmpty()) {
            Class<?> type = pending.poll();
            if (types.add(type) && type.isSealed()) {
                pending.addAll(Arrays.asList(type.getPermittedSubclasses()));
            }
        }
        return new ArrayList<>(types);
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            if (!SyntaxNodeOrToken.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }

            List<BeanPropertyWriter> filtered = new ArrayList<>();
            boolean hasKind = false;
            for (BeanPropertyWriter prop : beanProperties) {
                if (EXCLUDED_FIELDS.contains(prop.getName())) {
                    continue;
                }
                if ("kind".equals(prop.getName())) {
                    hasKind = true;
                }
                filtered.add(prop);
            }

            // Mixin did not reach kind() on this class; write it directly
            if (!hasKind) {
                filtered.add(new KindPropertyWriter());
            }
            return filtered;
        }
    }

    /**
     * A property writer that adds 'kind' to the JSON output from {@link SyntaxNodeOrToken#kind()}.
     */
    private static class KindPropertyWriter extends BeanPropertyWriter {

        KindPropertyWriter() {
            super();
        }

        @Override
        public String getName() {
            return "kind";
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            gen.writeStringField("kind", ((SyntaxNodeOrToken) bean).kind().name());
        }
    }
}
