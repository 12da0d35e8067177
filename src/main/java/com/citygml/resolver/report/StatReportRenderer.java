package com.citygml.resolver.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.analysis.LayerSummary;
import com.citygml.resolver.frequency.ResolvedFrequencyTable;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders layer summaries and aggregated frequencies as plain-text reports.
 */
public class StatReportRenderer {
    private static final Logger log = LoggerFactory.getLogger(StatReportRenderer.class);

    static final String LAYER_TEMPLATE = "stat-report.ftl";
    static final String FREQUENCY_TEMPLATE = "attribute-frequency.ftl";

    private final Configuration freemarkerConfig;

    public StatReportRenderer() {
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

    public String renderLayers(String source, List<LayerSummary> layers) {
        Map<String, Object> model = new HashMap<>();
        model.put("source", source);
        model.put("layers", layers);
        return render(LAYER_TEMPLATE, model);
    }

    public String renderFrequency(String layer, String attribute, String description, ResolvedFrequencyTable table) {
        Map<String, Object> model = new HashMap<>();
        model.put("layer", layer);
        model.put("attribute", attribute);
        model.put("description", description);
        model.put("frequencies", table.asMap());
        model.put("total", table.total());
        return render(FREQUENCY_TEMPLATE, model);
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            log.debug("Rendered {} ({} chars)", templateName, out.getBuffer().length());
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException(templateName, e);
        }
    }
}
