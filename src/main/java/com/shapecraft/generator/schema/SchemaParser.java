package com.shapecraft.generator.schema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.parser.ShapeParser;

/**
 * Parser for text schema files.
 *
 * Format:
 * - Type: type com.acme.Order [access=getter|field|record] [constructible=true|false]
 * - Member: name: Type[?|!] [readonly]   (? nullable, ! non-null, none unknown)
 * - End of type: end (optional)
 * - Comments: # comment
 */
public class SchemaParser {
    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    private static final Pattern TYPE_PATTERN = Pattern.compile(
            "^type\\s+([A-Za-z_$][\\w$]*(?:\\.[A-Za-z_$][\\w$]*)*)((?:\\s+\\w+\\s*=\\s*\\w+)*)\\s*$");

    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile("(\\w+)\\s*=\\s*(\\w+)");

    private static final Pattern MEMBER_PATTERN = Pattern.compile(
            "^([A-Za-z_$][\\w$]*)\\s*:\\s*(.+?)\\s*([?!])?(?:\\s+(readonly))?$");

    public SchemaDocument parse(Path schemaFile) throws IOException {
        return parse(Files.readAllLines(schemaFile));
    }

    public SchemaDocument parse(List<String> lines) {
        SchemaDocument doc = new SchemaDocument();
        Set<String> declared = collectTypeNames(lines);
        TypeNameResolver resolver = new TypeNameResolver(List.of(), null, declared, declared::contains);

        InMemoryTypeSchema.Builder schema = InMemoryTypeSchema.builder();
        TypeInfo.TypeInfoBuilder current = null;
        AccessStyle access = AccessStyle.GETTER;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = stripComment(line).trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            try {
                Matcher typeMatcher = TYPE_PATTERN.matcher(trimmed);
                if (typeMatcher.matches()) {
                    if (current != null) {
                        schema.type(current.build());
                    }
                    current = TypeInfo.builder().name(typeMatcher.group(1));
                    access = parseAttributes(typeMatcher.group(2), current);
                    continue;
                }
                if (trimmed.equals("end")) {
                    if (current == null) {
                        throw new IllegalArgumentException("'end' without a type");
                    }
                    schema.type(current.build());
                    current = null;
                    continue;
                }
                if (current == null) {
                    throw new IllegalArgumentException("Member outside of a type: " + trimmed);
                }
                MemberInfo member = parseMember(trimmed, access, resolver);
                current.member(member);
                log.debug("Parsed schema member: {} : {} ({})", member.getName(), member.getType(),
                        member.getNullability());
            } catch (RuntimeException e) {
                doc.addError("Line " + lineNum + ": " + e.getMessage());
                log.warn("Failed to parse schema line {}: {}", lineNum, e.getMessage());
            }
        }
        if (current != null) {
            schema.type(current.build());
        }

        doc.setSchema(schema.build());
        return doc;
    }

    private Set<String> collectTypeNames(List<String> lines) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : lines) {
            Matcher matcher = TYPE_PATTERN.matcher(stripComment(line).trim());
            if (matcher.matches()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }

    private AccessStyle parseAttributes(String attributes, TypeInfo.TypeInfoBuilder type) {
        AccessStyle access = AccessStyle.GETTER;
        Boolean constructible = null;
        Matcher matcher = ATTRIBUTE_PATTERN.matcher(attributes == null ? "" : attributes);
        while (matcher.find()) {
            String key = matcher.group(1).toLowerCase(Locale.ROOT);
            String value = matcher.group(2).toLowerCase(Locale.ROOT);
            switch (key) {
                case "access" -> access = switch (value) {
                    case "getter" -> AccessStyle.GETTER;
                    case "field" -> AccessStyle.FIELD;
                    case "record" -> AccessStyle.RECORD;
                    default -> throw new IllegalArgumentException("Unknown access style: " + value);
                };
                case "constructible" -> constructible = Boolean.parseBoolean(value);
                default -> throw new IllegalArgumentException("Unknown type attribute: " + key);
            }
        }
        type.defaultConstructible(constructible != null ? constructible : access != AccessStyle.RECORD);
        return access;
    }

    private MemberInfo parseMember(String line, AccessStyle access, TypeNameResolver resolver) {
        Matcher matcher = MEMBER_PATTERN.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid member format: " + line);
        }

        String name = matcher.group(1);
        TypeRef type = resolver.toTypeRef(ShapeParser.parseTypeExpression(matcher.group(2)));
        boolean readonly = matcher.group(4) != null;

        Nullability nullability = Nullability.UNKNOWN;
        if ("?".equals(matcher.group(3))) {
            nullability = Nullability.NULLABLE;
        } else if ("!".equals(matcher.group(3)) || type.isPrimitive()) {
            nullability = Nullability.NON_NULL;
        }

        AccessStyle write;
        if (readonly || access == AccessStyle.RECORD) {
            write = AccessStyle.NONE;
        } else {
            write = access == AccessStyle.FIELD ? AccessStyle.FIELD : AccessStyle.SETTER;
        }

        return MemberInfo.builder()
                .name(name)
                .type(type)
                .nullability(nullability)
                .readAccess(access)
                .writeAccess(write)
                .build();
    }

    private String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}
