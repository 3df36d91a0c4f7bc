package com.geonamesfst.entry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 记录标识到地名记录的只读映射。
 *
 * 只能通过 {@link Builder} 在导入阶段填充，构建完成后不可修改，可被任意多个查询线程共享。
 */
public final class EntryStore {
    private final Map<Long, GeoNamesEntry> entriesById;

    private EntryStore(Map<Long, GeoNamesEntry> entriesById) {
        this.entriesById = Collections.unmodifiableMap(entriesById);
    }

    public Optional<GeoNamesEntry> get(long id) {
        return Optional.ofNullable(entriesById.get(id));
    }

    public boolean contains(long id) {
        return entriesById.containsKey(id);
    }

    public int size() {
        return entriesById.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 导入阶段使用的可变构建器，同一标识重复写入时保留最后一条。
     */
    public static final class Builder {
        private final Map<Long, GeoNamesEntry> entriesById = new HashMap<>();
        private boolean built;

        private Builder() {
        }

        public Builder put(GeoNamesEntry entry) {
            if (built) {
                throw new IllegalStateException("EntryStore 已构建，不能继续写入");
            }
            entriesById.put(entry.id(), entry);
            return this;
        }

        public boolean contains(long id) {
            return entriesById.containsKey(id);
        }

        public int size() {
            return entriesById.size();
        }

        public EntryStore build() {
            built = true;
            return new EntryStore(entriesById);
        }
    }
}
