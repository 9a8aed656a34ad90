package com.improvtoolkit.ingest.service.dispatch;

import com.improvtoolkit.ingest.domain.ButtonEvent;
import com.improvtoolkit.ingest.domain.PriorityEnvelope;
import org.json.JSONObject;

/**
 * Wire form of button envelopes.
 *
 * <pre>
 * {"avatar_id":"avatar-1","message_type":"action","action":"speak","status":null,
 *  "version":1,"object_type":"ButtonData","time_stamp":1700000000.123,"priority":30}
 * </pre>
 */
public final class ButtonEventJson {

    public static final int VERSION = 1;
    public static final String OBJECT_TYPE = "ButtonData";

    private ButtonEventJson() {
        // Utility class
    }

    public static JSONObject toJson(PriorityEnvelope envelope) {
        ButtonEvent event = envelope.payload();
        JSONObject json = new JSONObject();
        json.put("avatar_id", event.sourceId());
        json.put("message_type", event.kind() == ButtonEvent.Kind.ACTION ? "action" : "status");
        json.put("action", event.action() == null ? JSONObject.NULL : event.action().wireName());
        json.put("status", event.status() == null ? JSONObject.NULL : event.status().wireName());
        json.put("version", VERSION);
        json.put("object_type", OBJECT_TYPE);
        json.put("time_stamp", event.timestamp().toEpochMilli() / 1000.0);
        json.put("priority", envelope.priority().value());
        return json;
    }

    public static String serialize(PriorityEnvelope envelope) {
        return toJson(envelope).toString();
    }
}
