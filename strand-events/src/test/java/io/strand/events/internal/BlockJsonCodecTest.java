// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import io.strand.core.error.BlockDecodingException;
import io.strand.core.model.Block;
import io.strand.core.model.ChaincodeEvent;
import io.strand.core.model.FilteredBlock;
import io.strand.core.model.TransactionType;
import io.strand.core.model.TxValidationCode;
import io.strand.events.RawEvent;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BlockJsonCodecTest {

    @Test
    void decodesFullBlock() {
        String json = """
                {"type":"block","block":{
                  "number":42,
                  "channelId":"mychannel",
                  "dataHash":"0x%s",
                  "transactions":[
                    {"txId":"abc123","type":"ENDORSER_TRANSACTION","validationCode":"VALID",
                     "chaincodeEvents":[{"chaincodeId":"cc1","eventName":"evt1","payload":"aGVsbG8="}]},
                    {"txId":"def456","type":3,"validationCode":11}
                  ]}}
                """.formatted("ab".repeat(32));

        RawEvent event = BlockJsonCodec.decodeEvent(json);

        RawEvent.BlockReceived received = assertInstanceOf(RawEvent.BlockReceived.class, event);
        Block block = received.block();
        assertEquals(42, block.number());
        assertEquals(42, event.blockNumber());
        assertEquals("mychannel", block.channelId());
        assertEquals("0x" + "ab".repeat(32), block.dataHash().value());
        assertNull(block.previousHash());
        assertEquals(2, block.transactions().size());
        assertEquals(TxValidationCode.VALID, block.transactions().get(0).validationCode());
        assertEquals(TransactionType.ENDORSER_TRANSACTION, block.transactions().get(1).type());
        assertEquals(TxValidationCode.MVCC_READ_CONFLICT, block.transactions().get(1).validationCode());

        ChaincodeEvent cc = block.transactions().get(0).chaincodeEvents().get(0);
        assertEquals("abc123", cc.txId());
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), cc.payload());
    }

    @Test
    void decodesFilteredBlock() {
        String json = """
                {"type":"filteredBlock","filteredBlock":{"number":7,"channelId":"ch","filteredTransactions":[
                  {"txId":"t1","validationCode":"mvcc_read_conflict",
                   "chaincodeEvents":[{"chaincodeId":"cc1","txId":"t1","eventName":"evt"}]}]}}
                """;

        RawEvent.FilteredBlockReceived received =
                assertInstanceOf(RawEvent.FilteredBlockReceived.class, BlockJsonCodec.decodeEvent(json));
        FilteredBlock block = received.filteredBlock();
        assertEquals(7, block.number());
        assertEquals(TxValidationCode.MVCC_READ_CONFLICT, block.filteredTransactions().get(0).validationCode());
        assertEquals(TransactionType.ENDORSER_TRANSACTION, block.filteredTransactions().get(0).type());
        assertEquals(0, block.filteredTransactions().get(0).chaincodeEvents().get(0).payload().length);
    }

    @Test
    void blockWithoutTransactionsIsAccepted() {
        RawEvent event = BlockJsonCodec.decodeEvent("{\"type\":\"block\",\"block\":{\"number\":0,\"channelId\":\"ch\"}}");
        assertTrue(((RawEvent.BlockReceived) event).block().transactions().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "[]",
            "{}",
            "{\"type\":\"heartbeat\"}",
            "{\"type\":\"block\"}",
            "{\"type\":\"block\",\"block\":{\"channelId\":\"ch\"}}",
            "{\"type\":\"block\",\"block\":{\"number\":\"x\",\"channelId\":\"ch\"}}",
            "{\"type\":\"block\",\"block\":{\"number\":-1,\"channelId\":\"ch\"}}",
            "{\"type\":\"block\",\"block\":{\"number\":1}}",
            "{\"type\":\"block\",\"block\":{\"number\":1,\"channelId\":\"ch\",\"transactions\":{}}}",
            "{\"type\":\"block\",\"block\":{\"number\":1,\"channelId\":\"ch\",\"transactions\":[{\"txId\":\"t\"}]}}",
            "{\"type\":\"block\",\"block\":{\"number\":1,\"channelId\":\"ch\",\"transactions\":[{\"txId\":\"t\",\"validationCode\":\"NOPE\"}]}}",
            "{\"type\":\"block\",\"block\":{\"number\":1,\"channelId\":\"ch\",\"dataHash\":\"0x12\"}}"
    })
    void malformedFramesFailWithBlockDecodingException(String json) {
        assertThrows(BlockDecodingException.class, () -> BlockJsonCodec.decodeEvent(json));
    }

    @Test
    void encodesSubscribeRequest() throws Exception {
        JsonNode node = BlockJsonCodec.MAPPER.readTree(BlockJsonCodec.encodeSubscribe(43L, true));

        assertEquals("subscribe", node.get("type").asText());
        assertEquals(43, node.get("startBlock").asLong());
        assertTrue(node.get("filtered").asBoolean());
    }

    @Test
    void subscribeWithoutStartBlockOmitsField() throws Exception {
        JsonNode node = BlockJsonCodec.MAPPER.readTree(BlockJsonCodec.encodeSubscribe(null, false));
        assertFalse(node.has("startBlock"));
        assertFalse(node.get("filtered").asBoolean());
    }
}
