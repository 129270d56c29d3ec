package org.smtbridge.emit;

import lombok.Getter;
import org.smtbridge.config.SmtLibVersion;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 发射得到的查询程序文本及其方言。
 */
@Getter
public final class SmtLibProgram {

    private final SmtLibVersion version;
    private final String text;

    public SmtLibProgram(SmtLibVersion version, String text) {
        this.version = Objects.requireNonNull(version, "Version cannot be null");
        this.text = Objects.requireNonNull(text, "Text cannot be null");
    }

    public List<String> lines() {
        return Arrays.asList(text.split("\n"));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SmtLibProgram that && version == that.version && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
