package io.mcg.engine.template;

import io.mcg.engine.shared.EngineException;

/** Input rendering failed: a required input is missing or a template cannot be read or written. */
public final class TemplateException extends EngineException {
    public TemplateException(String message) {
        super("template", message);
    }

    public TemplateException(String message, Throwable cause) {
        super("template", message, cause);
    }
}
