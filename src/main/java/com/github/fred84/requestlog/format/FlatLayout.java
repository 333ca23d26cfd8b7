package com.github.fred84.requestlog.format;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a record on a single line as {@code field='value'} tokens. The message, when declared, comes last.
 */
public class FlatLayout extends StructuredLayout {

    public FlatLayout() {
    }

    public FlatLayout(String template) {
        super(template);
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        List<String> tokens = new ArrayList<>();
        boolean withMessage = false;

        for (String field : getFields()) {
            if (MESSAGE.equals(field)) {
                withMessage = true;
                continue;
            }
            Object value = resolve(event, field);
            if (value != null) {
                tokens.add(token(field, value));
            }
        }
        if (withMessage) {
            tokens.add(token(MESSAGE, message(event)));
        }

        StringBuilder line = new StringBuilder(String.join(" ", tokens));
        String exception = exceptionText(event);
        if (exception != null) {
            line.append(' ').append(token(EXCEPTION, exception));
        }

        return line.append(CoreConstants.LINE_SEPARATOR).toString();
    }

    private static String token(String field, Object value) {
        return field + "='" + value + "'";
    }
}
