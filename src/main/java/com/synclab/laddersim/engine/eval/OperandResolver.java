package com.synclab.laddersim.engine.eval;

import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.CounterState;
import com.synclab.laddersim.engine.state.StateView;
import com.synclab.laddersim.engine.state.TimerState;

/**
 * Resolves operand strings against a state generation. Never throws: anything that cannot be
 * resolved reads as 0 / false.
 */
public final class OperandResolver {

    private OperandResolver() {
    }

    /** Numeric value of a literal or tag reference; unresolvable or {@code NaN} reads as 0. */
    public static double resolve(String operand, StateView view) {
        String address = Operand.strip(operand);
        if (address.isEmpty()) {
            return 0.0;
        }
        if (Operand.isLiteral(address)) {
            return finiteOrZero(Operand.parseLiteral(address));
        }
        Double value = lookup(address, view);
        return value == null ? 0.0 : finiteOrZero(value);
    }

    /**
     * Value stored for a tag address, or {@code null} when the address is unknown.
     * Lookup order: numeric register, timer/counter member, bit of a numeric word,
     * bare timer/counter (its ACC), boolean tag (1/0).
     */
    public static Double lookup(String address, StateView view) {
        Double numeric = view.numeric(address);
        if (numeric != null) {
            return numeric;
        }
        String parent = Operand.parentOf(address);
        String member = Operand.memberOf(address);
        if (parent != null && member != null) {
            TimerState timer = view.timer(parent);
            if (timer != null) {
                Double value = timer.member(member);
                if (value != null) {
                    return value;
                }
            }
            CounterState counter = view.counter(parent);
            if (counter != null) {
                Double value = counter.member(member);
                if (value != null) {
                    return value;
                }
            }
            Double word = view.numeric(parent);
            int bit = bitIndex(member);
            if (word != null && bit >= 0) {
                return ((((long) word.doubleValue()) >> bit) & 1L) == 1L ? 1.0 : 0.0;
            }
        }
        TimerState timer = view.timer(address);
        if (timer != null) {
            return (double) timer.getAcc();
        }
        CounterState counter = view.counter(address);
        if (counter != null) {
            return (double) counter.getAcc();
        }
        Boolean bool = view.tag(address);
        if (bool != null) {
            return bool ? 1.0 : 0.0;
        }
        return null;
    }

    /**
     * Boolean state of an address without forces: timer/counter status bits, then the tag
     * itself, then a bit of a numeric word ({@code Word.3}). Unknown reads as {@code false}.
     */
    public static boolean readBit(String address, StateView view) {
        String parent = Operand.parentOf(address);
        String member = Operand.memberOf(address);
        if (parent == null || member == null) {
            return Boolean.TRUE.equals(view.tag(address));
        }
        TimerState timer = view.timer(parent);
        if (timer != null) {
            switch (member) {
                case "EN":
                    return timer.isEn();
                case "TT":
                    return timer.isTt();
                case "DN":
                    return timer.isDn();
                default:
                    break;
            }
        }
        CounterState counter = view.counter(parent);
        if (counter != null) {
            switch (member) {
                case "CU":
                    return counter.isCu();
                case "CD":
                    return counter.isCd();
                case "DN":
                    return counter.isDn();
                case "OV":
                    return counter.isOv();
                case "UN":
                    return counter.isUn();
                default:
                    break;
            }
        }
        Boolean tag = view.tag(address);
        if (tag != null) {
            return tag;
        }
        Double word = view.numeric(parent);
        int bit = bitIndex(member);
        if (word != null && bit >= 0) {
            return ((((long) word.doubleValue()) >> bit) & 1L) == 1L;
        }
        return false;
    }

    static double finiteOrZero(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
    }

    private static int bitIndex(String member) {
        if (member == null || member.isEmpty() || member.length() > 2) {
            return -1;
        }
        for (int i = 0; i < member.length(); i++) {
            if (!Character.isDigit(member.charAt(i))) {
                return -1;
            }
        }
        int bit = Integer.parseInt(member);
        return bit < 64 ? bit : -1;
    }
}
