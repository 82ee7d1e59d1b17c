package guraa.sitephoto.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live counters of a running report build. Updated from worker threads.
 */
public class ReportProgress {

    private volatile String state = "queued";
    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger done = new AtomicInteger();
    private final AtomicInteger before = new AtomicInteger();
    private final AtomicInteger after = new AtomicInteger();
    private final AtomicInteger matched = new AtomicInteger();
    private final AtomicInteger unmatched = new AtomicInteger();

    public void startStage(String state, int total) {
        this.state = state;
        this.total.set(total);
        this.done.set(0);
    }

    public void setGroupSize(int beforeCount, int afterCount) {
        before.set(beforeCount);
        after.set(afterCount);
    }

    public void stepDone() {
        done.incrementAndGet();
    }

    public void finish(String state, int matchedCount, int unmatchedCount) {
        matched.set(matchedCount);
        unmatched.set(unmatchedCount);
        this.state = state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getState() {
        return state;
    }

    public int getDone() {
        return done.get();
    }

    public int getTotal() {
        return total.get();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("state", state);
        view.put("total", total.get());
        view.put("done", done.get());
        view.put("before", before.get());
        view.put("after", after.get());
        view.put("matched", matched.get());
        view.put("unmatched", unmatched.get());
        return view;
    }
}
