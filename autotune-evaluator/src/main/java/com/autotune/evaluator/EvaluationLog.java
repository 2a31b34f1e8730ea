package com.autotune.evaluator;

import com.autotune.runlog.ResultLog;
import com.autotune.runlog.TestRecord;
import com.autotune.vartree.space.Valuation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only, id-ordered log of test records owned by one evaluator.
 * <p>
 * Ids are handed out at submission with {@link #reserveId()}. Completed records may arrive in any
 * order; they wait in a pending map until every lower id has been appended or abandoned. Each
 * appended record is written to the {@link ResultLog} and passed to the listeners under the same
 * lock, so the file and the callbacks see strict id order. A valuation is logged at most once.
 */
public final class EvaluationLog {

    private static final Logger log = LoggerFactory.getLogger(EvaluationLog.class);

    private final ResultLog resultLog;
    private final List<Consumer<TestRecord>> listeners = new CopyOnWriteArrayList<>();

    private final List<TestRecord> records = new ArrayList<>();
    private final List<TestRecord> failures = new ArrayList<>();
    private final Map<Valuation, TestRecord> byValuation = new HashMap<>();
    private final Map<Integer, TestRecord> pending = new HashMap<>();
    private final Set<Integer> abandoned = new HashSet<>();
    private int nextId = 1;
    private int nextToAppend = 1;
    private int seeded;

    public EvaluationLog(ResultLog resultLog) {
        this.resultLog = resultLog != null ? resultLog : ResultLog.disabled();
    }

    /** Called for every appended record, in id order, on the thread that completed it. */
    public void addListener(Consumer<TestRecord> listener) {
        listeners.add(listener);
    }

    /**
     * Loads records from a previous run before any evaluation. They are renumbered 1..n, written to
     * the result log first and never re-executed.
     *
     * @throws IllegalStateException if ids were already handed out
     */
    public synchronized void seed(List<TestRecord> prior) {
        if (nextId != 1) {
            throw new IllegalStateException("Log can only be seeded before the first evaluation");
        }
        for (TestRecord record : prior) {
            if (byValuation.containsKey(record.getValuation())) {
                log.warn("Seed record repeats a valuation, skipped | valuation={}", record.getValuation());
                continue;
            }
            TestRecord renumbered = record.withTestId(nextId++);
            store(renumbered);
            resultLog.append(renumbered);
            nextToAppend++;
            seeded++;
        }
        log.info("EvaluationLog seeded | records={}", seeded);
    }

    /** Next test id, assigned at submission. */
    public synchronized int reserveId() {
        return nextId++;
    }

    /** Record already logged for {@code valuation}, or null. */
    public synchronized TestRecord find(Valuation valuation) {
        return byValuation.get(valuation);
    }

    public boolean contains(Valuation valuation) {
        return find(valuation) != null;
    }

    /** Hands in a finished record; it is appended once all lower ids are appended or abandoned. */
    public void complete(TestRecord record) {
        synchronized (this) {
            int id = record.getTestId();
            if (id < nextToAppend || id >= nextId || pending.containsKey(id)) {
                throw new IllegalArgumentException("Test id " + id + " was not reserved or is already complete");
            }
            pending.put(id, record);
            drain();
        }
    }

    /** Gives up on a reserved id; nothing is logged for it. */
    public void abandon(int testId) {
        synchronized (this) {
            if (testId < nextToAppend || testId >= nextId) return;
            abandoned.add(testId);
            drain();
        }
        log.info("EvaluationLog abandon | testId={}", testId);
    }

    private void drain() {
        while (true) {
            if (abandoned.remove(nextToAppend)) {
                nextToAppend++;
                continue;
            }
            TestRecord next = pending.remove(nextToAppend);
            if (next == null) return;
            nextToAppend++;
            if (byValuation.containsKey(next.getValuation())) {
                log.warn("Duplicate valuation completed, dropped | testId={} | valuation={}",
                        next.getTestId(), next.getValuation());
                continue;
            }
            store(next);
            resultLog.append(next);
            for (Consumer<TestRecord> l : listeners) {
                try {
                    l.accept(next);
                } catch (RuntimeException e) {
                    log.warn("Log listener failed | testId={} | error={}", next.getTestId(), e.getMessage(), e);
                }
            }
        }
    }

    private void store(TestRecord record) {
        records.add(record);
        byValuation.put(record.getValuation(), record);
        if (!record.isSuccess()) failures.add(record);
    }

    /** Snapshot of appended records in id order. */
    public synchronized List<TestRecord> getRecords() {
        return List.copyOf(records);
    }

    /** Snapshot of failed records in id order. */
    public synchronized List<TestRecord> getFailures() {
        return List.copyOf(failures);
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized int failureCount() {
        return failures.size();
    }

    /** Number of records loaded by {@link #seed}. */
    public synchronized int seededCount() {
        return seeded;
    }

    /** Records still waiting for a lower id. */
    public synchronized int pendingCount() {
        return pending.size();
    }
}
