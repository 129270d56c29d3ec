package org.smtbridge.sexpr;

import java.util.ArrayList;
import java.util.List;

/**
 * SMT-LIB 2 输出的规整：
 * <ul>
 *     <li>递归去掉 {@code (to_real n)} 包装 (z3 在实数目标值里加的，语义上无意义)；</li>
 *     <li>把 {@code ((v (LAMBDA ... x)))} 形式的绑定改写成 {@code ((v x))} (cvc4 对数组类绑定的输出)。</li>
 * </ul>
 */
public final class SmtLib2Normalizer implements OutputNormalizer {

    public static final SmtLib2Normalizer INSTANCE = new SmtLib2Normalizer();

    private SmtLib2Normalizer() {
    }

    @Override
    public SExpr normalize(SExpr expr) {
        return unwrapLambda(stripToReal(expr));
    }

    private static SExpr stripToReal(SExpr e) {
        if (!(e instanceof SExpr.App app)) {
            return e;
        }
        if (app.size() == 2 && app.get(0).isCon("to_real")) {
            return stripToReal(app.get(1));
        }
        List<SExpr> items = new ArrayList<>(app.size());
        boolean changed = false;
        for (SExpr item : app.getItems()) {
            SExpr n = stripToReal(item);
            changed |= n != item;
            items.add(n);
        }
        return changed ? SExpr.app(items) : e;
    }

    private static SExpr unwrapLambda(SExpr e) {
        if (e instanceof SExpr.App outer && outer.size() >= 1
                && outer.get(0) instanceof SExpr.App binding && binding.size() >= 2
                && binding.get(1) instanceof SExpr.App lambda && lambda.isAppHeadedBy("LAMBDA") && lambda.size() > 1) {
            SExpr value = lambda.get(lambda.size() - 1);
            return SExpr.app(SExpr.app(binding.get(0), value));
        }
        return e;
    }
}
