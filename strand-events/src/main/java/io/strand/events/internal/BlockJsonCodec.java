// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.strand.core.InternalApi;
import io.strand.core.error.BlockDecodingException;
import io.strand.core.model.Block;
import io.strand.core.model.ChaincodeEvent;
import io.strand.core.model.FilteredBlock;
import io.strand.core.model.FilteredTransaction;
import io.strand.core.model.Transaction;
import io.strand.core.model.TransactionType;
import io.strand.core.model.TxValidationCode;
import io.strand.core.types.Hash;
import io.strand.events.RawEvent;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * JSON wire format of the WebSocket event stream.
 *
 * <p>
 * Client to server:
 *
 * <pre>{@code
 * {"type":"subscribe","startBlock":42,"filtered":false}
 * }</pre>
 *
 * <p>
 * Server to client, one event per text frame:
 *
 * <pre>{@code
 * {"type":"block","block":{"number":42,"channelId":"mychannel","dataHash":"0x..","previousHash":"0x..",
 *   "transactions":[{"txId":"abc","type":"ENDORSER_TRANSACTION","validationCode":"VALID",
 *     "chaincodeEvents":[{"chaincodeId":"cc1","eventName":"evt1","payload":"aGVsbG8="}]}]}}
 * {"type":"filteredBlock","filteredBlock":{"number":42,"channelId":"mychannel","filteredTransactions":[...]}}
 * }</pre>
 *
 * <p>
 * Enum fields accept either the constant name or the numeric code. Payloads are
 * Base64. Chaincode events may omit {@code txId}; the enclosing transaction id is
 * used.
 */
@InternalApi
public final class BlockJsonCodec {

    /**
     * Shared, thread-safe ObjectMapper instance.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private BlockJsonCodec() {
        // Utility class
    }

    /**
     * Decodes one server frame.
     *
     * @param text the frame text
     * @return the decoded event
     * @throws BlockDecodingException if the frame is not valid JSON or misses required fields
     */
    public static RawEvent decodeEvent(final String text) {
        JsonNode node;
        try {
            node = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new BlockDecodingException("Malformed event frame: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new BlockDecodingException("Event frame is not a JSON object");
        }
        String type = requiredText(node, "type");
        try {
            return switch (type) {
                case "block" -> new RawEvent.BlockReceived(decodeBlock(requiredObject(node, "block")));
                case "filteredBlock" -> new RawEvent.FilteredBlockReceived(
                        decodeFilteredBlock(requiredObject(node, "filteredBlock")));
                default -> throw new BlockDecodingException("Unknown event type: " + type);
            };
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new BlockDecodingException("Invalid " + type + " event: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes the subscribe request sent after the handshake.
     *
     * @param startBlock first block to stream, or {@code null} for the newest
     * @param filtered   whether the server should send filtered blocks
     * @return the request text
     */
    public static String encodeSubscribe(final @Nullable Long startBlock, final boolean filtered) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "subscribe");
        if (startBlock != null) {
            node.put("startBlock", startBlock.longValue());
        }
        node.put("filtered", filtered);
        return node.toString();
    }

    static Block decodeBlock(final JsonNode node) {
        long number = requiredLong(node, "number");
        List<Transaction> txs = new ArrayList<>();
        for (JsonNode tx : optionalArray(node, "transactions")) {
            String txId = requiredText(tx, "txId");
            txs.add(new Transaction(
                    txId,
                    transactionType(tx.get("type")),
                    validationCode(tx.get("validationCode")),
                    chaincodeEvents(tx, txId)));
        }
        return new Block(
                number,
                optionalHash(node, "dataHash"),
                optionalHash(node, "previousHash"),
                requiredText(node, "channelId"),
                txs);
    }

    static FilteredBlock decodeFilteredBlock(final JsonNode node) {
        long number = requiredLong(node, "number");
        List<FilteredTransaction> txs = new ArrayList<>();
        for (JsonNode tx : optionalArray(node, "filteredTransactions")) {
            String txId = requiredText(tx, "txId");
            txs.add(new FilteredTransaction(
                    txId,
                    transactionType(tx.get("type")),
                    validationCode(tx.get("validationCode")),
                    chaincodeEvents(tx, txId)));
        }
        return new FilteredBlock(number, requiredText(node, "channelId"), txs);
    }

    private static List<ChaincodeEvent> chaincodeEvents(final JsonNode tx, final String txId) {
        List<ChaincodeEvent> events = new ArrayList<>();
        for (JsonNode ev : optionalArray(tx, "chaincodeEvents")) {
            JsonNode evTxId = ev.get("txId");
            JsonNode payload = ev.get("payload");
            events.add(new ChaincodeEvent(
                    requiredText(ev, "chaincodeId"),
                    evTxId == null || evTxId.isNull() ? txId : evTxId.asText(),
                    requiredText(ev, "eventName"),
                    payload == null || payload.isNull() ? null : Base64.getDecoder().decode(payload.asText())));
        }
        return events;
    }

    private static TransactionType transactionType(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return TransactionType.ENDORSER_TRANSACTION;
        }
        if (node.isInt()) {
            return TransactionType.fromCode(node.asInt());
        }
        return TransactionType.valueOf(node.asText().toUpperCase(Locale.ROOT));
    }

    private static TxValidationCode validationCode(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            throw new BlockDecodingException("Missing field 'validationCode'");
        }
        if (node.isInt()) {
            return TxValidationCode.fromCode(node.asInt());
        }
        return TxValidationCode.valueOf(node.asText().toUpperCase(Locale.ROOT));
    }

    private static @Nullable Hash optionalHash(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return new Hash(value.asText());
    }

    private static Iterable<JsonNode> optionalArray(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new BlockDecodingException("Field '" + field + "' must be an array");
        }
        return value;
    }

    private static JsonNode requiredObject(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new BlockDecodingException("Missing object field '" + field + "'");
        }
        return value;
    }

    private static String requiredText(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new BlockDecodingException("Missing field '" + field + "'");
        }
        return value.asText();
    }

    private static long requiredLong(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new BlockDecodingException("Missing numeric field '" + field + "'");
        }
        return value.asLong();
    }
}
