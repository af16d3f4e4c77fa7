package org.transparentclassroom.client.freemarker;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;
import lombok.Getter;
import org.transparentclassroom.client.freemarker.exception.ConvertException;
import org.transparentclassroom.client.freemarker.exception.FreeMarkerException;
import org.transparentclassroom.client.freemarker.exception.FreeMarkerFormatException;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Application-wide singleton for FreeMarker template configuration and execution.
 * <p>
 * - Renders route URL templates such as {@code api/v1/${model_name}/${object_id}.json}.
 * - Numbers render without grouping separators, so ids drop into paths verbatim.
 * - Compiled templates are cached by their source text.
 * </p>
 */
public class FreeMarkerEngine {

    /** Singleton instance of engine for global access. */
    @Getter
    private static final FreeMarkerEngine instance = new FreeMarkerEngine();

    /** FreeMarker configuration: thread-safe, global per application. */
    private static final Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);

    static {
        cfg.setDefaultEncoding("UTF-8");
        cfg.setNumberFormat("computer");
        cfg.setBooleanFormat("c");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
    }

    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    private FreeMarkerEngine() {
    }

    /**
     * Renders a FreeMarker template string with provided variable bindings.
     *
     * @param template  The template text as a string.
     * @param variables Bindings (variable name -> TemplateModel).
     * @return The rendered template result as a trimmed string.
     * @throws FreeMarkerFormatException If the template renders with error.
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
     * Compiles (or fetches from cache) a FreeMarker template from the provided string.
     *
     * @param templateText Plain template source code.
     * @return The compiled FreeMarker Template object.
     * @throws FreeMarkerException If the template cannot be parsed.
     */
    public Template getTemplate(String templateText) {
        return templates.computeIfAbsent(templateText, text -> {
            try {
                return new Template("route", text, cfg);
            } catch (IOException e) {
                throw new FreeMarkerException(e.getMessage(), e);
            }
        });
    }

    /**
     * Converts a Java object to a FreeMarker TemplateModel, for use as a variable in templates.
     *
     * @param value Arbitrary Java object (primitives, strings, collections).
     * @return Corresponding TemplateModel for FreeMarker binding.
     * @throws ConvertException If wrapping fails.
     */
    public static TemplateModel convert(Object value) throws ConvertException {
        try {
            return cfg.getObjectWrapper().wrap(value);
        } catch (TemplateModelException e) {
            throw ConvertException.buildConvertException(e);
        }
    }

}
