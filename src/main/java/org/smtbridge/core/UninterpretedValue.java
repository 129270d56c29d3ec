package org.smtbridge.core;

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 未解释排序中的一个值：求解器给出的标签，以及 (排序带枚举时) 它在枚举中的下标。
 */
@Getter
public final class UninterpretedValue {

    // 为 null 表示排序没有枚举，标签原样保留
    @Getter(lombok.AccessLevel.NONE)
    private final Integer index;
    private final String label;

    public UninterpretedValue(Integer index, String label) {
        this.index = index;
        this.label = Objects.requireNonNull(label, "Label cannot be null");
    }

    public Optional<Integer> getIndex() {
        return Optional.ofNullable(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UninterpretedValue that)) {
            return false;
        }
        return Objects.equals(index, that.index) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, label);
    }

    @Override
    public String toString() {
        return label;
    }
}
