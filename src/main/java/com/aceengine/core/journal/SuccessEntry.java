package com.aceengine.core.journal;

import com.aceengine.core.receipt.Receipt;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Written only after the new content is durably in place.
 * May embed the sealed {@link Receipt} so receipts can be verified from journals alone.
 */
public final class SuccessEntry extends JournalEntry {

    @JsonProperty("after_sha")
    private final String afterSha;

    @JsonProperty("after_size")
    private final long afterSize;

    @JsonProperty("receipt_id")
    private final String receiptId;

    @JsonProperty("receipt")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final Receipt receipt;

    @JsonCreator
    public SuccessEntry(
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("file") String file,
            @JsonProperty("after_sha") String afterSha,
            @JsonProperty("after_size") long afterSize,
            @JsonProperty("receipt_id") String receiptId,
            @JsonProperty("receipt") Receipt receipt
    ) {
        super(timestamp, file);
        this.afterSha  = afterSha;
        this.afterSize = afterSize;
        this.receiptId = receiptId;
        this.receipt   = receipt;
    }

    public String getAfterSha()  { return afterSha; }
    public long   getAfterSize() { return afterSize; }
    public String getReceiptId() { return receiptId; }

    public Optional<Receipt> receipt() {
        return Optional.ofNullable(receipt);
    }
}
