package com.shapecraft.generator.codegen.forward;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.generator.EmissionContext;
import com.shapecraft.generator.codegen.generator.TypeRenderer;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.shape.TypeResolver;
import com.shapecraft.generator.codegen.util.NamingUtil;
import com.shapecraft.generator.codegen.variant.EmissionStrategy;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Emits the forward transform of a call site: a method returning
 * {@code Function<Source, Target>} and a list convenience method.
 */
public class ForwardCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ForwardCodeGenerator.class);

    private final EmissionContext ctx;

    public ForwardCodeGenerator(EmissionContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @return the name of the generated forward method
     */
    public String generate(AnalyzedCallSite site) {
        CallSite callSite = site.getCallSite();
        TypeRenderer types = ctx.getTypes();
        Structure root = site.getRoot();

        String source = types.render(site.getSourceType());
        String target = types.render(TypeResolver.structureType(root));
        String function = ctx.reference("java.util.function.Function") + "<" + source + ", " + target + ">";
        String method = ctx.claimMemberName(site.getMethodName());

        JavaExpressionWriter writer = new JavaExpressionWriter(ctx, site);
        List<String> parameters = new ArrayList<>();
        List<String> arguments = new ArrayList<>();
        for (Map.Entry<String, TypeRef> capture : site.getCaptureTypes().entrySet()) {
            String name = NamingUtil.safeIdentifier(capture.getKey());
            parameters.add(types.render(capture.getValue()) + " " + name);
            arguments.add(name);
        }
        String parameter = writer.bind(callSite.getParameterName());
        String lambda = parameter + " -> " + parameter + " == null ? null : "
                + writer.construct((ShapeNode) callSite.getBody());

        StringBuilder sb = new StringBuilder();
        sb.append("    /**\n");
        sb.append("     * Projection ").append(describe(callSite)).append(" of {@code ")
                .append(site.getSourceType().simpleName()).append("}, declared at ")
                .append(callSite.location()).append(".\n");
        sb.append("     */\n");
        if (site.getEmissionStrategy() == EmissionStrategy.PREBUILT_TRANSFORM) {
            String constant = ctx.claimMemberName(NamingUtil.toScreamingSnakeCase(method) + "_TRANSFORM");
            ctx.addHelper(constant, "    private static final " + function + " " + constant + " =\n"
                    + "            " + lambda + ";\n");
            sb.append("    public static ").append(function).append(" ").append(method).append("() {\n");
            sb.append("        return ").append(constant).append(";\n");
            sb.append("    }\n");
        } else {
            sb.append("    public static ").append(function).append(" ").append(method)
                    .append("(").append(String.join(", ", parameters)).append(") {\n");
            sb.append("        return ").append(lambda).append(";\n");
            sb.append("    }\n");
        }
        ctx.addPublicMember(sb.toString());
        ctx.addPublicMember(listMethod(method, source, target, parameters, arguments));

        log.debug("Forward transform {}.{} for {} ({})", ctx.getClassName(), method, callSite.location(),
                site.getEmissionStrategy());
        return method;
    }

    private String listMethod(String method, String source, String target, List<String> parameters,
                              List<String> arguments) {
        String list = ctx.reference("java.util.List");
        String name = ctx.claimMemberName(method + "All");
        List<String> allParameters = new ArrayList<>();
        allParameters.add(ctx.reference("java.util.Collection") + "<? extends " + source + "> source");
        allParameters.addAll(parameters);

        StringBuilder sb = new StringBuilder();
        sb.append("    public static ").append(list).append("<").append(target).append("> ").append(name)
                .append("(").append(String.join(", ", allParameters)).append(") {\n");
        sb.append("        if (source == null) {\n");
        sb.append("            return new ").append(ctx.reference("java.util.ArrayList")).append("<>();\n");
        sb.append("        }\n");
        sb.append("        return source.stream().map(").append(method).append("(")
                .append(String.join(", ", arguments)).append(")).collect(")
                .append(ctx.reference("java.util.stream.Collectors")).append(".toList());\n");
        sb.append("    }\n");
        return sb.toString();
    }

    private static String describe(CallSite callSite) {
        return callSite.getName() != null ? "{@code " + callSite.getName() + "}" : "(anonymous)";
    }
}
