package com.coedit.socket.session;

import lombok.Value;

/**
 * In-memory authoritative content of one document.
 * <p>
 * Not thread-safe: every access goes through the owning {@link DocumentRoom}'s lock.
 * </p>
 */
public class DocumentState {
    private final String documentId;
    private String content;
    private long lastAppliedTimestamp = Long.MIN_VALUE;
    private boolean dirty;
    private long version;

    public DocumentState(String documentId, String content) {
        this.documentId = documentId;
        this.content = content;
    }

    /**
     * Last-write-wins apply. An update whose timestamp equals the current one replaces it,
     * so among equal timestamps the later arrival at this instance wins.
     *
     * @param newContent Full document text
     * @param timestamp  Update timestamp (epoch millis)
     * @param markDirty  true for edits that this instance must persist
     * @return false if the update is older than the applied content and was discarded
     */
    public boolean apply(String newContent, long timestamp, boolean markDirty) {
        if (timestamp < lastAppliedTimestamp) {
            return false;
        }
        content = newContent;
        lastAppliedTimestamp = timestamp;
        version++;
        if (markDirty) {
            dirty = true;
        }
        return true;
    }

    /**
     * @return the content to flush, or null when there is nothing unsaved
     */
    public Snapshot captureIfDirty() {
        return dirty ? new Snapshot(documentId, content, version) : null;
    }

    /**
     * Clears the dirty flag if no edit was applied since the snapshot was taken.
     *
     * @return true if the document is now clean
     */
    public boolean markFlushed(long capturedVersion) {
        if (version == capturedVersion) {
            dirty = false;
        }
        return !dirty;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getContent() {
        return content;
    }

    public long getLastAppliedTimestamp() {
        return lastAppliedTimestamp;
    }

    public boolean isDirty() {
        return dirty;
    }

    public long getVersion() {
        return version;
    }

    @Value
    public static class Snapshot {
        String documentId;
        String content;
        long version;
    }
}
