package com.funcpool.execution;

import com.funcpool.exception.ExecutionException;
import com.funcpool.parser.PythonLiterals;
import com.funcpool.resolve.AliasBinding;
import com.funcpool.resolve.ResolvedProgram;
import com.funcpool.resolve.ResolvedUnit;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a resolved program as a single Python script. Each unit is executed in its own scope and
 * published as the {@code _fp_v_0} attribute of the namespace object of its hash.
 */
public class ProgramRenderer {
    private static final Logger log = LoggerFactory.getLogger(ProgramRenderer.class);

    static final String PROGRAM_TEMPLATE = "program.py.ftl";

    private final Configuration freemarkerConfig;

    public ProgramRenderer() {
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

    public String render(ResolvedProgram program) {
        Map<String, Object> model = new HashMap<>();
        model.put("entryHash", program.getEntryHash());

        List<Map<String, Object>> units = new ArrayList<>();
        for (ResolvedUnit unit : program.getUnits()) {
            Map<String, Object> view = new HashMap<>();
            view.put("hash", unit.getHash());
            view.put("language", unit.getLanguage());
            view.put("functionName", unit.getFunctionName());
            view.put("nameLiteral", PythonLiterals.reprString(unit.getFunctionName()));
            view.put("sourceLiteral", PythonLiterals.reprString(unit.getSource()));
            view.put("references", unit.getReferences());

            List<Map<String, Object>> direct = new ArrayList<>();
            List<Map<String, Object>> deferred = new ArrayList<>();
            for (AliasBinding binding : program.getEnvironment().bindingsOf(unit.getHash())) {
                Map<String, Object> bindingView = Map.of(
                        "aliasLiteral", PythonLiterals.reprString(binding.getAlias()),
                        "target", binding.getTarget());
                (binding.isDeferred() ? deferred : direct).add(bindingView);
            }
            view.put("direct", direct);
            view.put("deferred", deferred);
            units.add(view);
        }
        model.put("units", units);

        try {
            Template template = freemarkerConfig.getTemplate(PROGRAM_TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            log.debug("Rendered program for {} with {} units", program.getEntryHash(), units.size());
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ExecutionException("Failed to render program for " + program.getEntryHash(), e);
        }
    }
}
