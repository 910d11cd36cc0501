package org.forcecom.restapi.freemarker;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;
import lombok.Getter;
import org.forcecom.restapi.freemarker.exception.FreeMarkerException;
import org.forcecom.restapi.freemarker.exception.FreeMarkerFormatException;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

/**
 * Application-wide singleton for rendering REST endpoint paths from FreeMarker templates.
 * <p>
 * - Numbers render in computer format and booleans as {@code true}/{@code false}, so versions and
 *   flags never pick up locale grouping.
 * - URL escaping ({@code ?url}) uses UTF-8.
 * - Template errors are rethrown, never written into the output.
 * </p>
 */
public class FreeMarkerEngine {

    /** Singleton instance of engine for global access. */
    @Getter
    private static final FreeMarkerEngine instance = new FreeMarkerEngine();

    /** Freemarker configuration: thread-safe once set up. */
    private static final Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);

    static {
        cfg.setBooleanFormat("c");
        cfg.setNumberFormat("computer");
        cfg.setURLEscapingCharset("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
    }

    /**
     * Renders a template with plain Java values as bindings.
     *
     * @param template  The template text.
     * @param variables Variable name to Java value.
     * @return The rendered, trimmed result.
     * @throws FreeMarkerFormatException If the template fails to compile or render.
     */
    public String render(String template, Map<String, ?> variables) throws FreeMarkerFormatException {
        Map<String, TemplateModel> models = new HashMap<>();
        for (Map.Entry<String, ?> variable : variables.entrySet()) {
            models.put(variable.getKey(), convert(variable.getValue()));
        }
        return process(template, models);
    }

    /**
     * Renders a Freemarker template string with provided variable bindings.
     *
     * @param template  The template text as a string.
     * @param variables Bindings (variable name -> TemplateModel).
     * @return The rendered template result as a trimmed string.
     * @throws FreeMarkerFormatException If the template fails to compile or renders with error.
     */
    public String process(String template, Map<String, TemplateModel> variables)
            throws FreeMarkerFormatException {
        StringWriter stringWriter = new StringWriter();
        try {
            getTemplate(template).process(variables, stringWriter);
        } catch (IOException | TemplateException ex) {
            throw new FreeMarkerFormatException(ex.getMessage(), ex);
        }
        return stringWriter.toString().trim();
    }

    /**
     * Compiles a Freemarker template from the provided string.
     *
     * @param templateText Plain template source code.
     * @return The compiled Freemarker Template object.
     * @throws FreeMarkerException If the template cannot be parsed.
     */
    public Template getTemplate(String templateText) {
        try {
            return new Template("endpoint", templateText, cfg);
        } catch (IOException e) {
            throw new FreeMarkerException(e.getMessage(), e);
        }
    }

    /**
     * Converts a Java object to a Freemarker TemplateModel.
     *
     * @param value Arbitrary Java object.
     * @return Corresponding TemplateModel.
     * @throws FreeMarkerException If wrapping fails.
     */
    public static TemplateModel convert(Object value) throws FreeMarkerException {
        try {
            return cfg.getObjectWrapper().wrap(value);
        } catch (TemplateModelException e) {
            throw new FreeMarkerException("Cannot expose value to template: " + value, e);
        }
    }
}
