package com.ganesh.keep.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.keep.error.EncryptionException;

/**
 * The plaintext of a secure record: {@code {"k": logicalName, "v": value}}.
 *
 * <p>Carrying the name inside the ciphertext lets sub-key discovery recover names that the
 * hashed physical id hides.
 */
final class SecureEnvelope {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final Object value;

    private SecureEnvelope(String name, Object value) {
        this.name = name;
        this.value = value;
    }

    static String seal(String name, Object value) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("k", name);
        node.set("v", MAPPER.valueToTree(value));
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Failed to serialize secure value", name, e);
        }
    }

    /**
     * @throws EncryptionException if {@code json} is not an envelope, usually because the key was wrong.
     */
    static SecureEnvelope open(String json) {
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Decrypted data is not a secure envelope", e);
        }
        if (node == null || !node.isObject() || !node.path("k").isTextual() || !node.has("v")) {
            throw new EncryptionException("Decrypted data is not a secure envelope");
        }
        Object value = MAPPER.convertValue(node.get("v"), Object.class);
        return new SecureEnvelope(node.get("k").asText(), value);
    }

    String getName() { return name; }
    Object getValue() { return value; }
}
