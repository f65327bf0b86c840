package com.agenthost.client.message;

import com.agenthost.protocol.payload.ToolCallPayload;
import com.agenthost.protocol.payload.ToolResultPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds the content and tool events of one session into a single in-progress
 * assistant message.
 * <p>
 * A message that ends with no text but with tool calls or results is never
 * finalized on its own: its tool data is carried into the next message that
 * starts. If the exchange ends while tool data is still carried, a trailing
 * message holding only that data is finalized.
 * <p>
 * Not thread-safe; the owning session serializes access.
 */
@Slf4j
public class MessageAccumulator {

    public static final String CANCELLED_PLACEHOLDER = "_Response cancelled_";
    public static final String SESSION_EXPIRED_PLACEHOLDER = "_Session expired_";

    private final String idPrefix;
    private final MessageSink sink;
    private final List<ToolCallRecord> carriedCalls = new ArrayList<>();
    private final List<ToolResultRecord> carriedResults = new ArrayList<>();
    private StreamingMessage current;
    private int counter;

    public MessageAccumulator(String idPrefix, MessageSink sink) {
        this.idPrefix = idPrefix;
        this.sink = sink;
    }

    public Optional<StreamingMessage> current() {
        return Optional.ofNullable(current);
    }

    public boolean hasActiveMessage() {
        return current != null;
    }

    public boolean hasCarriedToolData() {
        return !carriedCalls.isEmpty() || !carriedResults.isEmpty();
    }

    /**
     * Start a message in THINKING state unless one is already in progress.
     */
    public void begin() {
        if (current == null) {
            ensureMessage();
            publish();
        }
    }

    public void appendChunk(String text) {
        ensureMessage().append(text);
        publish();
    }

    public void toolCallsDetected(List<ToolCallPayload> calls) {
        StreamingMessage message = ensureMessage();
        for (ToolCallPayload call : calls) {
            message.addToolCall(new ToolCallRecord(call.getCallId(), call.getToolName(), ToolCallRecord.CALLING));
        }
        publish();
    }

    /**
     * Socket {@code tool_call}: one call with a server-chosen status. A repeat
     * for a call still in flight updates it instead of adding another.
     */
    public void toolCall(String callId, String name, String status) {
        StreamingMessage message = ensureMessage();
        String effective = status == null ? ToolCallRecord.CALLING : status;
        if (!message.updateToolCall(callId, name, effective)) {
            message.addToolCall(new ToolCallRecord(callId, name, effective));
        }
        message.markToolCalling();
        publish();
    }

    public void toolExecuting(String name) {
        StreamingMessage message = ensureMessage();
        if (name != null) {
            message.updateToolCall(null, name, ToolCallRecord.EXECUTING);
        }
        message.markToolCalling();
        publish();
    }

    public void toolResult(ToolResultPayload payload) {
        StreamingMessage message = ensureMessage();
        String callId = message.resolveCallId(payload.getCallId(), payload.getToolName());
        boolean success = payload.succeeded();
        if (callId != null || payload.getToolName() != null) {
            message.updateToolCall(callId, payload.getToolName(),
                    success ? ToolCallRecord.COMPLETED : ToolCallRecord.FAILED);
        }
        message.addToolResult(ToolResultRecord.fromPayload(payload, callId));
        publish();
    }

    /**
     * {@code message_complete}. A non-empty {@code authoritativeText} replaces
     * what was accumulated.
     */
    public void complete(String authoritativeText) {
        if (current == null) {
            if (authoritativeText == null || authoritativeText.isEmpty()) {
                return;
            }
            ensureMessage();
        }
        StreamingMessage message = current;
        message.complete(authoritativeText);
        if (message.getContent().isBlank()) {
            carryForward(message);
        } else {
            detach(message);
        }
    }

    /**
     * @return false if no message was in progress
     */
    public boolean cancel() {
        if (current == null) {
            return false;
        }
        StreamingMessage message = current;
        message.cancel(CANCELLED_PLACEHOLDER);
        detach(message);
        return true;
    }

    /**
     * Freeze the message with an error text, creating one if needed so the
     * error is visible.
     *
     * @param keepContent keep what was already streamed, using {@code text}
     *                    only if nothing was
     */
    public void fail(String text, boolean keepContent) {
        StreamingMessage message = ensureMessage();
        message.fail(text, keepContent);
        detach(message);
    }

    /**
     * Throw away the message in progress and any carried tool data.
     */
    public void discard() {
        if (current != null) {
            String id = current.getId();
            current = null;
            sink.onMessageDropped(id);
        }
        carriedCalls.clear();
        carriedResults.clear();
    }

    /**
     * End of the exchange: finalize whatever is open, then flush carried tool
     * data as a trailing message.
     */
    public void finishExchange() {
        if (current != null) {
            StreamingMessage message = current;
            if (message.getContent().isBlank() && !message.hasToolData()) {
                current = null;
                sink.onMessageDropped(message.getId());
            } else {
                complete(null);
            }
        }
        if (hasCarriedToolData()) {
            StreamingMessage trailing = new StreamingMessage(nextId());
            trailing.absorb(carriedCalls, carriedResults);
            carriedCalls.clear();
            carriedResults.clear();
            trailing.complete(null);
            sink.onMessageFinalized(trailing.snapshot());
        }
    }

    // ==================== internals ====================

    private StreamingMessage ensureMessage() {
        if (current == null) {
            current = new StreamingMessage(nextId());
            if (hasCarriedToolData()) {
                current.absorb(carriedCalls, carriedResults);
                carriedCalls.clear();
                carriedResults.clear();
            }
        }
        return current;
    }

    private void carryForward(StreamingMessage message) {
        log.debug("Carrying tool data of empty message {} forward", message.getId());
        carriedCalls.addAll(message.getToolCalls());
        carriedResults.addAll(message.getToolResults());
        current = null;
        sink.onMessageDropped(message.getId());
    }

    private void detach(StreamingMessage message) {
        current = null;
        sink.onMessageFinalized(message.snapshot());
    }

    private void publish() {
        sink.onMessageUpdated(current.snapshot());
    }

    private String nextId() {
        return idPrefix + "-" + (++counter);
    }
}
