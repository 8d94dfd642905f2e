package com.shapecraft.generator.codegen.util;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import com.shapecraft.generator.codegen.exception.TemplateRenderingException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the FreeMarker templates under {@code /templates} on the class path.
 * Thread-safe once constructed.
 */
public class TemplateRenderer {

    private final Configuration freemarkerConfig;

    public TemplateRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new TemplateRenderingException("Failed to render template " + templateName, e);
        }
    }
}
