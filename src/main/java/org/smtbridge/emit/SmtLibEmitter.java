package org.smtbridge.emit;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smtbridge.capability.CapabilityGate;
import org.smtbridge.config.RoundingMode;
import org.smtbridge.config.SmtConfig;
import org.smtbridge.config.SmtLibVersion;
import org.smtbridge.core.NamedSymVar;
import org.smtbridge.core.Quantifier;
import org.smtbridge.program.IncrementalUpdate;
import org.smtbridge.program.SymbolicProgram;
import org.smtbridge.response.SmtModel;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 发射的入口：先做能力检查，再按配置的方言分派给对应的写出器。
 */
public final class SmtLibEmitter {

    private static final Logger logger = LoggerFactory.getLogger(SmtLibEmitter.class);

    private SmtLibEmitter() {
    }

    /**
     * 把符号程序翻译为一次性查询程序。
     * @throws org.smtbridge.exceptions.CapabilityException 如果求解器不支持问题所需的特性。
     */
    public static SmtLibProgram toSmtLib(SmtConfig config, SymbolicProgram program) {
        Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(program, "Program cannot be null");
        CapabilityGate.check(program, config);
        SmtLibVersion version = config.getSmtLibVersion();
        String text = switch (version) {
            case SMTLIB2 -> new SmtLib2Writer(config).program(program);
        };
        logger.info("为求解器 {} 生成 {} 程序 ({} 个输入, {} 个约束)",
                config.getSolver().getName(), version, program.getInputs().size(), program.getConstraints().size());
        return new SmtLibProgram(version, text);
    }

    /**
     * 把增量更新翻译为可以在 push/pop 之间发送的片段。
     * @throws org.smtbridge.exceptions.CapabilityException 如果新内容需要求解器不支持的特性。
     */
    public static SmtLibProgram toIncSmtLib(SmtConfig config, IncrementalUpdate update) {
        Objects.requireNonNull(config, "Config cannot be null");
        Objects.requireNonNull(update, "Update cannot be null");
        CapabilityGate.check(update.getKinds(), true, List.of(), List.of(), config.getSolver());
        SmtLibVersion version = config.getSmtLibVersion();
        String text = switch (version) {
            case SMTLIB2 -> new SmtLib2Writer(config).incremental(update);
        };
        logger.debug("生成增量片段: {} 个新输入, {} 个新约束", update.getNewInputs().size(), update.getConstraints().size());
        return new SmtLibProgram(version, text);
    }

    /**
     * 生成排除已知模型的断言，用于继续索取新的模型。
     * @return 每个模型一条断言；有全称输入或没有模型时为空。
     */
    public static Optional<List<String>> addNonEqConstraints(SmtLibVersion version, RoundingMode rm,
                                                             List<Pair<Quantifier, NamedSymVar>> inputs,
                                                             List<SmtModel> models) {
        Objects.requireNonNull(inputs, "Inputs cannot be null");
        Objects.requireNonNull(models, "Models cannot be null");
        return switch (version) {
            case SMTLIB2 -> SmtLib2Writer.nonEqConstraints(rm, inputs, models);
        };
    }
}
