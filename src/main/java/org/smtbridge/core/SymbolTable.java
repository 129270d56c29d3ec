package org.smtbridge.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.exceptions.AmbiguityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 一次求解会话中所有具名输入变量的表，即求解器输出可能引用的全部符号。
 * 在解释任何输出之前构建一次，此后只读；独立的表可以被并发使用。
 */
public final class SymbolTable {

    private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

    // 求解器输出中的变量名约定：s 后跟十进制 ID
    private static final Pattern INPUT_NAME = Pattern.compile("s(\\d+)");

    private final List<NamedSymVar> vars;
    private final Map<Integer, List<NamedSymVar>> byId;

    /**
     * 构造函数。
     * @param vars 会话中的全部具名变量。允许同一 ID 出现多次，此时解析该 ID 会报告歧义。
     */
    public SymbolTable(Collection<NamedSymVar> vars) {
        Objects.requireNonNull(vars, "Variable collection cannot be null.");
        this.vars = List.copyOf(vars);
        Map<Integer, List<NamedSymVar>> index = new HashMap<>();
        for (NamedSymVar v : this.vars) {
            index.computeIfAbsent(v.getId(), k -> new ArrayList<>()).add(v);
        }
        this.byId = Collections.unmodifiableMap(index);
        logger.debug("SymbolTable 初始化完成，管理 {} 个变量。", this.vars.size());
    }

    public static SymbolTable of(NamedSymVar... vars) {
        return new SymbolTable(List.of(vars));
    }

    public List<NamedSymVar> getVars() {
        return vars;
    }

    /**
     * 根据求解器输出中的符号找到对应变量。
     * @param symbol 求解器输出中的符号，例如 "s3"。
     * @return 唯一匹配的变量；符号不符合命名约定或没有匹配时为空。
     * @throws AmbiguityException 如果有多个变量匹配该 ID。
     */
    public Optional<NamedSymVar> resolve(String symbol) {
        Matcher m = INPUT_NAME.matcher(symbol);
        if (!m.matches()) {
            return Optional.empty();
        }
        int id;
        try {
            id = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // ID 超出 int 范围，不可能是本会话中的变量
            logger.debug("符号 {} 的 ID 超出范围，忽略", symbol);
            return Optional.empty();
        }
        List<NamedSymVar> matches = byId.getOrDefault(id, List.of());
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() > 1) {
            logger.error("符号 {} 匹配到多个变量: {}", symbol, matches);
            throw new AmbiguityException(symbol, matches.stream().map(NamedSymVar::toString).collect(Collectors.toList()));
        }
        return Optional.of(matches.get(0));
    }

    public int size() {
        return vars.size();
    }

    @Override
    public String toString() {
        return vars.toString();
    }
}
