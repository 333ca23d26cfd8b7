package com.github.fred84.requestlog.format;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.github.fred84.requestlog.filter.ContextMergeFilter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Base of the layouts rendering a record as a set of named fields. Fields are declared by a template such as
 * {@code "%(asctime) %(levelname) %(message) %(request_id)"}; anything between the markers is ignored.
 *
 * <p>Besides the standard record attributes a field may name any key of the merged log context (see
 * {@link ContextMergeFilter}) or of the MDC. Fields that cannot be resolved are left out.
 */
public abstract class StructuredLayout extends LayoutBase<ILoggingEvent> {

    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd HH:mm:ss,SSS";

    static final String MESSAGE = "message";
    static final String EXCEPTION = "exception";

    private static final Pattern FIELD = Pattern.compile("%\\((.*?)\\)");

    private String template;
    private String dateFormat = DEFAULT_DATE_FORMAT;
    private List<String> fields = Collections.emptyList();
    private DateTimeFormatter dateFormatter;

    protected StructuredLayout() {
    }

    protected StructuredLayout(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public String getDateFormat() {
        return dateFormat;
    }

    public void setDateFormat(String dateFormat) {
        this.dateFormat = dateFormat;
    }

    @Override
    public void start() {
        if (template == null || template.isBlank()) {
            addError("No template set for " + getClass().getSimpleName());
            return;
        }

        try {
            dateFormatter = DateTimeFormatter.ofPattern(dateFormat).withZone(ZoneId.systemDefault());
        } catch (IllegalArgumentException e) {
            addError("Invalid date format [" + dateFormat + "]", e);
            return;
        }

        fields = fields(template);
        super.start();
    }

    /**
     * Field names in the order they appear in {@code template}.
     */
    static List<String> fields(String template) {
        List<String> result = new ArrayList<>();
        Matcher matcher = FIELD.matcher(template);
        while (matcher.find()) {
            result.add(matcher.group(1));
        }
        return Collections.unmodifiableList(result);
    }

    protected List<String> getFields() {
        return fields;
    }

    /**
     * Value of {@code field} for {@code event}, {@code null} if the field cannot be resolved.
     */
    @Nullable
    protected Object resolve(ILoggingEvent event, String field) {
        switch (field) {
            case MESSAGE:
                return message(event);
            case "asctime":
                return dateFormatter.format(Instant.ofEpochMilli(event.getTimeStamp()));
            case "levelname":
                return event.getLevel().toString();
            case "name":
                return event.getLoggerName();
            case "threadName":
                return event.getThreadName();
            case "created":
                return event.getTimeStamp();
            case ContextMergeFilter.CONTEXT:
                return ContextMergeFilter.mergedContext(event).orElse(null);
            case "module":
                return caller(event).map(StackTraceElement::getClassName).orElse(null);
            case "funcName":
                return caller(event).map(StackTraceElement::getMethodName).orElse(null);
            case "lineno":
                return caller(event).map(StackTraceElement::getLineNumber).orElse(null);
            case "pathname":
                return caller(event).map(StackTraceElement::getFileName).orElse(null);
            default:
                Map<String, Object> context = ContextMergeFilter.mergedContext(event).orElse(Collections.emptyMap());
                Object value = context.get(field);
                return value != null ? value : event.getMDCPropertyMap().get(field);
        }
    }

    protected static String message(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        return message == null ? "" : message;
    }

    @Nullable
    protected static String exceptionText(ILoggingEvent event) {
        IThrowableProxy proxy = event.getThrowableProxy();
        return proxy == null ? null : ThrowableProxyUtil.asString(proxy).stripTrailing();
    }

    /**
     * Turns scalars into strings, keeping the shape of maps and collections.
     */
    protected static Object stringify(Object value) {
        if (value instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), stringify(v)));
            return result;
        }
        if (value instanceof Collection) {
            List<Object> result = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                result.add(stringify(item));
            }
            return result;
        }
        if (value instanceof Object[]) {
            return stringify(Arrays.asList((Object[]) value));
        }
        return String.valueOf(value);
    }

    private static Optional<StackTraceElement> caller(ILoggingEvent event) {
        StackTraceElement[] callerData = event.getCallerData();
        return callerData == null || callerData.length == 0 ? Optional.empty() : Optional.of(callerData[0]);
    }
}
