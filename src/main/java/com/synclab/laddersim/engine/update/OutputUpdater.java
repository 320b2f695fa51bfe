package com.synclab.laddersim.engine.update;

import com.synclab.laddersim.engine.eval.ExpressionEvaluator;
import com.synclab.laddersim.engine.eval.OperandResolver;
import com.synclab.laddersim.engine.eval.PowerFlowResult;
import com.synclab.laddersim.engine.model.Instruction;
import com.synclab.laddersim.engine.model.InstructionSite;
import com.synclab.laddersim.engine.model.Opcode;
import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.engine.state.CounterState;
import com.synclab.laddersim.engine.state.ScanUpdates;
import com.synclab.laddersim.engine.state.SimulationState;
import com.synclab.laddersim.engine.state.TimerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Write-back half of a scan: turns a {@link PowerFlowResult} into the next values of coils,
 * timers, counters and numeric destinations. Instructions are handled in source order so a
 * later instruction sees what an earlier one wrote in the same scan. Nothing is written to the
 * given state; the caller commits the returned batch.
 */
public class OutputUpdater {

    private static final Logger log = LoggerFactory.getLogger(OutputUpdater.class);

    public static final long DEFAULT_TIMER_PRESET_MS = 5000L;
    public static final int DEFAULT_COUNTER_PRESET = 10;
    public static final int DEFAULT_MAX_BLOCK_LENGTH = 128;

    private final long defaultTimerPreset;
    private final int defaultCounterPreset;
    private final int maxBlockLength;

    public OutputUpdater() {
        this(DEFAULT_TIMER_PRESET_MS, DEFAULT_COUNTER_PRESET, DEFAULT_MAX_BLOCK_LENGTH);
    }

    public OutputUpdater(long defaultTimerPreset, int defaultCounterPreset, int maxBlockLength) {
        this.defaultTimerPreset = Math.max(0L, defaultTimerPreset);
        this.defaultCounterPreset = defaultCounterPreset;
        this.maxBlockLength = Math.max(1, maxBlockLength);
    }

    public ScanUpdates computeUpdates(List<Instruction> instructions,
                                      PowerFlowResult powerFlow,
                                      SimulationState state,
                                      long elapsedMillis) {
        WorkingState working = new WorkingState(state);
        long elapsed = Math.max(0L, elapsedMillis);
        for (int i = 0; i < instructions.size(); i++) {
            Instruction instruction = instructions.get(i);
            try {
                apply(i, instruction, powerFlow.isInstructionEnergized(i), powerFlow.isPowerIn(i), working, elapsed);
            } catch (RuntimeException e) {
                log.warn("Instruction {} at {} produced no update: {}", instruction, i, e.getMessage());
            }
        }
        return working.toUpdates();
    }

    private void apply(int index, Instruction instruction, boolean energized, boolean powerIn,
                       WorkingState working, long elapsed) {
        switch (instruction.getOpcode()) {
            case XIC, XIO, EQU, NEQ, LES, LEQ, GRT, GEQ, LIM, CMP, UNSUPPORTED -> {
                // read-only
            }
            case ONS -> writeBit(working, instruction.getOperand(0), powerIn);
            case OSR -> {
                boolean rising = powerIn && !OperandResolver.readBit(instruction.getOperand(0), working);
                writeBit(working, instruction.getOperand(1), rising);
                writeBit(working, instruction.getOperand(0), powerIn);
            }
            case OSF -> {
                boolean falling = !powerIn && OperandResolver.readBit(instruction.getOperand(0), working);
                writeBit(working, instruction.getOperand(1), falling);
                writeBit(working, instruction.getOperand(0), powerIn);
            }
            case OTE -> writeBit(working, instruction.getOperand(0), energized);
            case OTL -> {
                if (energized) {
                    writeBit(working, instruction.getOperand(0), true);
                }
            }
            case OTU -> {
                if (energized) {
                    writeBit(working, instruction.getOperand(0), false);
                }
            }
            case TON, TONR -> {
                TimerState timer = timer(instruction, working);
                if (timer != null && !resetRequested(instruction, timer, working)) {
                    onDelay(timer, energized, elapsed, false);
                }
            }
            case RTO -> {
                TimerState timer = timer(instruction, working);
                if (timer != null) {
                    onDelay(timer, energized, elapsed, true);
                }
            }
            case TOF, TOFR -> {
                TimerState timer = timer(instruction, working);
                if (timer != null && !resetRequested(instruction, timer, working)) {
                    offDelay(timer, energized, elapsed);
                }
            }
            case CTU, CTD, CTUD -> count(index, instruction, energized, working);
            case RES -> {
                if (energized) {
                    reset(instruction.getOperand(0), working);
                }
            }
            case ADD, SUB, MUL, DIV, MOD, NEG, ABS, CPT -> {
                if (energized) {
                    math(instruction, working);
                }
            }
            case MOV, MVM, COP, FLL, CLR -> {
                if (energized) {
                    move(instruction, working);
                }
            }
        }
    }

    private TimerState timer(Instruction instruction, WorkingState working) {
        String tag = instruction.getOperand(0);
        if (Operand.isUnspecified(tag)) {
            return null;
        }
        TimerState existing = working.timer(tag);
        long fallback = existing != null && existing.getPre() > 0 ? existing.getPre() : defaultTimerPreset;
        Double preset = preset(instruction.getOperand(1), working);
        TimerState timer = working.timerForWrite(tag, fallback);
        timer.setPre(preset != null ? (long) preset.doubleValue() : fallback);
        return timer;
    }

    /** TONR/TOFR reset input in operand 2: holds the timer cleared while set. */
    private boolean resetRequested(Instruction instruction, TimerState timer, WorkingState working) {
        if (instruction.getOpcode() != Opcode.TONR
                && instruction.getOpcode() != Opcode.TOFR) {
            return false;
        }
        String reset = instruction.getOperand(2);
        if (Operand.isUnspecified(reset) || Operand.isLiteral(reset)) {
            return false;
        }
        if (OperandResolver.readBit(reset, working)) {
            timer.reset();
            return true;
        }
        return false;
    }

    private static void onDelay(TimerState timer, boolean energized, long elapsed, boolean retentive) {
        if (energized) {
            timer.setEn(true);
            if (timer.getAcc() < timer.getPre()) {
                timer.setAcc(Math.min(timer.getPre(), timer.getAcc() + elapsed));
            }
            timer.setDn(timer.getAcc() >= timer.getPre());
            timer.setTt(!timer.isDn());
        } else if (retentive) {
            timer.setEn(false);
            timer.setTt(false);
            timer.setDn(timer.getAcc() >= timer.getPre());
        } else {
            timer.reset();
        }
    }

    private static void offDelay(TimerState timer, boolean energized, long elapsed) {
        if (energized) {
            timer.setEn(true);
            timer.setDn(true);
            timer.setTt(false);
            timer.setAcc(0L);
            return;
        }
        timer.setEn(false);
        if (!timer.isDn()) {
            timer.setTt(false);
            return;
        }
        timer.setAcc(Math.min(timer.getPre(), timer.getAcc() + elapsed));
        if (timer.getAcc() >= timer.getPre()) {
            timer.setDn(false);
            timer.setTt(false);
        } else {
            timer.setTt(true);
        }
    }

    private void count(int index, Instruction instruction, boolean energized, WorkingState working) {
        String tag = instruction.getOperand(0);
        if (Operand.isUnspecified(tag)) {
            return;
        }
        InstructionSite site = InstructionSite.of(index, instruction);
        boolean rising = energized && !working.previousEnergized(site);
        working.putEdge(site, energized);

        CounterState existing = working.counter(tag);
        int fallback = existing != null ? existing.getPre() : defaultCounterPreset;
        Double preset = preset(instruction.getOperand(1), working);
        CounterState counter = working.counterForWrite(tag, fallback);
        counter.setPre(preset != null ? clampToInt(preset) : fallback);

        switch (instruction.getOpcode()) {
            case CTU -> {
                counter.setCu(energized);
                if (rising) {
                    counter.countUp();
                }
            }
            case CTD -> {
                counter.setCd(energized);
                if (rising) {
                    counter.countDown();
                }
            }
            case CTUD -> {
                counter.setCu(energized);
                if (rising) {
                    counter.countUp();
                }
                String down = instruction.getOperand(2);
                if (!Operand.isUnspecified(down) && !Operand.isLiteral(down)) {
                    // CD keeps last scan's down input, so it doubles as the down-edge memory
                    boolean downInput = OperandResolver.readBit(down, working);
                    boolean downRising = downInput && !counter.isCd();
                    counter.setCd(downInput);
                    if (downRising) {
                        counter.countDown();
                    }
                }
            }
            default -> throw new IllegalStateException("not a counter: " + instruction.getOpcode());
        }
    }

    private static void reset(String tag, WorkingState working) {
        if (Operand.isUnspecified(tag)) {
            return;
        }
        TimerState timer = working.timer(tag);
        if (timer != null) {
            working.timerForWrite(tag, timer.getPre()).reset();
        }
        CounterState counter = working.counter(tag);
        if (counter != null) {
            working.counterForWrite(tag, counter.getPre()).reset();
        }
    }

    private void math(Instruction instruction, WorkingState working) {
        switch (instruction.getOpcode()) {
            case ADD -> writeNumeric(working, instruction.getOperand(2), source(instruction, 0, working) + source(instruction, 1, working));
            case SUB -> writeNumeric(working, instruction.getOperand(2), source(instruction, 0, working) - source(instruction, 1, working));
            case MUL -> writeNumeric(working, instruction.getOperand(2), source(instruction, 0, working) * source(instruction, 1, working));
            case DIV -> {
                double divisor = source(instruction, 1, working);
                writeNumeric(working, instruction.getOperand(2), divisor == 0.0 ? 0.0 : source(instruction, 0, working) / divisor);
            }
            case MOD -> {
                double divisor = source(instruction, 1, working);
                writeNumeric(working, instruction.getOperand(2), divisor == 0.0 ? 0.0 : source(instruction, 0, working) % divisor);
            }
            case NEG -> writeNumeric(working, instruction.getOperand(1), -source(instruction, 0, working));
            case ABS -> writeNumeric(working, instruction.getOperand(1), Math.abs(source(instruction, 0, working)));
            case CPT -> writeNumeric(working, instruction.getOperand(0),
                    ExpressionEvaluator.evaluate(instruction.getOperand(1), working));
            default -> throw new IllegalStateException("not a math instruction: " + instruction.getOpcode());
        }
    }

    private void move(Instruction instruction, WorkingState working) {
        switch (instruction.getOpcode()) {
            case MOV -> writeNumeric(working, instruction.getOperand(1), source(instruction, 0, working));
            case MVM -> {
                long src = (long) source(instruction, 0, working);
                long mask = (long) source(instruction, 1, working);
                String dest = instruction.getOperand(2);
                long current = (long) OperandResolver.resolve(dest, working);
                writeNumeric(working, dest, (double) ((src & mask) | (current & ~mask)));
            }
            case CLR -> writeNumeric(working, instruction.getOperand(0), 0.0);
            case FLL -> {
                double value = source(instruction, 0, working);
                String dest = instruction.getOperand(1);
                int length = blockLength(instruction.getOperand(2), working);
                if (length == 1) {
                    writeNumeric(working, dest, value);
                } else {
                    for (int k = 0; k < length; k++) {
                        writeNumeric(working, Operand.element(dest, k), value);
                    }
                }
            }
            case COP -> {
                String src = instruction.getOperand(0);
                String dest = instruction.getOperand(1);
                int length = blockLength(instruction.getOperand(2), working);
                if (length == 1) {
                    writeNumeric(working, dest, OperandResolver.resolve(src, working));
                } else {
                    // read the whole source first so overlapping blocks copy like a snapshot
                    double[] values = new double[length];
                    for (int k = 0; k < length; k++) {
                        values[k] = OperandResolver.resolve(Operand.element(src, k), working);
                    }
                    for (int k = 0; k < length; k++) {
                        writeNumeric(working, Operand.element(dest, k), values[k]);
                    }
                }
            }
            default -> throw new IllegalStateException("not a move instruction: " + instruction.getOpcode());
        }
    }

    private int blockLength(String operand, WorkingState working) {
        if (Operand.isUnspecified(operand)) {
            return 1;
        }
        double length = OperandResolver.resolve(operand, working);
        if (length < 1) {
            return 1;
        }
        return (int) Math.min(maxBlockLength, length);
    }

    private static double source(Instruction instruction, int operand, WorkingState working) {
        return OperandResolver.resolve(instruction.getOperand(operand), working);
    }

    /** Preset operand value, or {@code null} when the operand is absent or names nothing known. */
    private static Double preset(String operand, WorkingState working) {
        String address = Operand.strip(operand);
        if (Operand.isUnspecified(address)) {
            return null;
        }
        if (Operand.isLiteral(address)) {
            double value = Operand.parseLiteral(address);
            return Double.isNaN(value) ? null : value;
        }
        return OperandResolver.lookup(address, working);
    }

    private static int clampToInt(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    /**
     * Boolean write. {@code Word.n} sets a bit of an existing numeric word; anything else is a
     * plain tag.
     */
    private static void writeBit(WorkingState working, String operand, boolean value) {
        String address = Operand.strip(operand);
        if (Operand.isUnspecified(address) || Operand.isLiteral(address)) {
            return;
        }
        String parent = Operand.parentOf(address);
        String member = Operand.memberOf(address);
        if (parent != null && member != null && isBitIndex(member) && working.numeric(parent) != null
                && working.tag(address) == null) {
            long word = (long) working.numeric(parent).doubleValue();
            long mask = 1L << Integer.parseInt(member);
            working.putNumeric(parent, (double) (value ? word | mask : word & ~mask));
            return;
        }
        working.putTag(address, value);
    }

    /**
     * Numeric write. {@code Timer.ACC}/{@code .PRE} and {@code Counter.ACC}/{@code .PRE} update
     * the timer or counter record; everything else is a numeric register.
     */
    private static void writeNumeric(WorkingState working, String operand, double raw) {
        String address = Operand.strip(operand);
        if (Operand.isUnspecified(address) || Operand.isLiteral(address)) {
            return;
        }
        double value = Double.isNaN(raw) || Double.isInfinite(raw) ? 0.0 : raw;
        String parent = Operand.parentOf(address);
        String member = Operand.memberOf(address);
        if (parent != null && ("ACC".equals(member) || "PRE".equals(member))) {
            TimerState timer = working.timer(parent);
            if (timer != null) {
                TimerState target = working.timerForWrite(parent, timer.getPre());
                if ("ACC".equals(member)) {
                    target.setAcc((long) value);
                } else {
                    target.setPre((long) value);
                }
                target.setDn(target.getAcc() >= target.getPre());
                return;
            }
            CounterState counter = working.counter(parent);
            if (counter != null) {
                CounterState target = working.counterForWrite(parent, counter.getPre());
                if ("ACC".equals(member)) {
                    target.setAcc(clampToInt(value));
                } else {
                    target.setPre(clampToInt(value));
                }
                return;
            }
        }
        working.putNumeric(address, value);
    }

    private static boolean isBitIndex(String member) {
        if (member.isEmpty() || member.length() > 2) {
            return false;
        }
        for (int i = 0; i < member.length(); i++) {
            if (!Character.isDigit(member.charAt(i))) {
                return false;
            }
        }
        return Integer.parseInt(member) < 64;
    }
}
