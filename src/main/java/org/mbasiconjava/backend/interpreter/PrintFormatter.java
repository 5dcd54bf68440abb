package org.mbasiconjava.backend.interpreter;

import org.mbasiconjava.core.Configuration;
import org.mbasiconjava.frontend.astnode.Expr;
import org.mbasiconjava.frontend.astnode.PrintSeparator;
import org.mbasiconjava.runtime.runtimetypes.BasicValue;

import java.util.List;

/**
 * Lays out PRINT items. Each item is written as soon as it is evaluated so
 * TAB and POS see the live column.
 * <p>
 * Numbers print with a leading sign position and a trailing blank, strings
 * as they are. A comma moves to the next 14-column zone, wrapping when that
 * zone would start past the device width. A semicolon joins items; the
 * newline is written only when the last item has no separator.
 */
public final class PrintFormatter {

    private PrintFormatter() {
    }

    public static void print(PrintTarget target, List<Expr> items, List<PrintSeparator> separators,
                             ExpressionEvaluator evaluator) {
        if (items.isEmpty()) {
            target.emit("\n");
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            BasicValue value = evaluator.evaluate(items.get(i));
            target.emit(itemText(value));
            PrintSeparator separator = i < separators.size() ? separators.get(i) : PrintSeparator.NONE;
            switch (separator) {
                case COMMA -> nextZone(target);
                case SEMICOLON -> {
                }
                case NONE -> {
                    if (i == items.size() - 1) {
                        target.emit("\n");
                    }
                }
            }
        }
    }

    public static String itemText(BasicValue value) {
        return value.isString() ? value.getString() : BasicValue.formatNumber(value.toNumber());
    }

    static void nextZone(PrintTarget target) {
        int column = target.column();
        int next = (column / Configuration.printZoneWidth + 1) * Configuration.printZoneWidth;
        if (next >= target.width()) {
            target.emit("\n");
        } else {
            target.emit(" ".repeat(next - column));
        }
    }
}
