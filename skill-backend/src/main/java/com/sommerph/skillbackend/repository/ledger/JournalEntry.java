package com.sommerph.skillbackend.repository.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One step of a unit journal kept by {@link JsonFileLedgerStore}. {@code file} is relative to the
 * storage directory.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JournalEntry {

    public enum Kind {
        // content is the file as it was before the unit touched it, null if it did not exist
        BEFORE_IMAGE,
        // id was appended to the index file
        INDEX_APPEND,
        // id was removed from the index file
        INDEX_REMOVE
    }

    private Kind kind;
    private String file;
    private String content;
    private long id;

    public static JournalEntry beforeImage(String file, String content) {
        return new JournalEntry(Kind.BEFORE_IMAGE, file, content, 0L);
    }

    public static JournalEntry indexAppend(String file, long id) {
        return new JournalEntry(Kind.INDEX_APPEND, file, null, id);
    }

    public static JournalEntry indexRemove(String file, long id) {
        return new JournalEntry(Kind.INDEX_REMOVE, file, null, id);
    }

}
