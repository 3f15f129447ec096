package email.agent.app.rules;

import email.agent.app.message.InboundMessage;

import java.util.function.Function;

/**
 * Message fields a rule condition can test. A field absent on the message reads as "".
 */
public enum ConditionField {
    FROM_EMAIL("from_email", InboundMessage::getFromEmail),
    FROM_NAME("from_name", InboundMessage::getFromName),
    SUBJECT("subject", InboundMessage::getSubject),
    BODY_TEXT("body_text", InboundMessage::getBodyText),
    SNIPPET("snippet", InboundMessage::getSnippet);

    private final String value;
    private final Function<InboundMessage, String> accessor;

    ConditionField(String value, Function<InboundMessage, String> accessor) {
        this.value = value;
        this.accessor = accessor;
    }

    public String getValue() {
        return value;
    }

    public String extract(InboundMessage message) {
        String fieldValue = accessor.apply(message);
        return fieldValue != null ? fieldValue : "";
    }

    public static ConditionField fromValue(String value) {
        for (ConditionField field : values()) {
            if (field.value.equals(value)) {
                return field;
            }
        }
        throw new InvalidRuleException("Unknown condition field: " + value);
    }
}
