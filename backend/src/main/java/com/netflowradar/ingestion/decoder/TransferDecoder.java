package com.netflowradar.ingestion.decoder;

import com.netflowradar.common.HexQuantity;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Decodes ERC20 Transfer logs. from/to come from the low-order 20 bytes of topics[1] and topics[2]
 * (the 12 padding bytes are ignored); the amount is the whole data payload read as a big-endian unsigned integer.
 */
@Component
public class TransferDecoder {

    /** keccak256("Transfer(address,address,uint256)"). */
    public static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    static final int REQUIRED_TOPICS = 3;
    private static final int TOPIC_HEX_LENGTH = 64;
    private static final int ADDRESS_HEX_LENGTH = 40;

    private final Clock clock;

    public TransferDecoder(Clock clock) {
        this.clock = clock;
    }

    public TransferEvent decode(RawLog log) {
        if (log == null) {
            throw new TransferDecodeException(DecodeError.MALFORMED_LOG, "Log is null");
        }
        List<String> topics = log.topics();
        if (topics.size() < REQUIRED_TOPICS) {
            throw new TransferDecodeException(DecodeError.MALFORMED_LOG,
                    "Expected at least " + REQUIRED_TOPICS + " topics, got " + topics.size() + " (tx " + log.transactionHash() + ")");
        }
        if (!TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
            throw new TransferDecodeException(DecodeError.UNEXPECTED_EVENT,
                    "topic0 " + topics.get(0) + " is not Transfer (tx " + log.transactionHash() + ")");
        }
        String from = topicToAddress(topics.get(1));
        String to = topicToAddress(topics.get(2));
        BigInteger amount;
        try {
            amount = HexQuantity.parseUnsigned(log.data());
        } catch (NumberFormatException e) {
            throw new TransferDecodeException(DecodeError.MALFORMED_LOG,
                    "Data is not an unsigned integer: " + log.data() + " (tx " + log.transactionHash() + ")", e);
        }
        return new TransferEvent(from, to, amount, log.blockNumber(), log.transactionHash(), log.logIndex(), clock.instant());
    }

    private static String topicToAddress(String topic) {
        if (topic == null || topic.length() != TOPIC_HEX_LENGTH + 2 || !topic.regionMatches(true, 0, "0x", 0, 2)) {
            throw new TransferDecodeException(DecodeError.MALFORMED_LOG, "Malformed address topic: " + topic);
        }
        // high-order 12 bytes are padding and are not inspected
        String address = topic.substring(topic.length() - ADDRESS_HEX_LENGTH);
        if (!HexQuantity.isHex(address)) {
            throw new TransferDecodeException(DecodeError.MALFORMED_LOG, "Malformed address topic: " + topic);
        }
        return "0x" + address.toLowerCase(Locale.ROOT);
    }
}
