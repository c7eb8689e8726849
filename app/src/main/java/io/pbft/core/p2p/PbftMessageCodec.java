package io.pbft.core.p2p;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pbft.core.protocol.PbftMessage;

/** JSON wire form of {@link PbftMessage}; block payload bytes travel as base64. */
public final class PbftMessageCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PbftMessageCodec() {}

    public static String encode(PbftMessage message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message, e);
        }
    }

    /** @throws IllegalArgumentException if the text is not a valid message */
    public static PbftMessage decode(String json) {
        try {
            return MAPPER.readValue(json, PbftMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed PBFT message: " + e.getOriginalMessage(), e);
        }
    }
}
