package com.pulsewire.core;

import com.pulsewire.core.collector.CollectRequest;
import com.pulsewire.core.collector.Collector;
import com.pulsewire.core.collector.CollectorResult;
import com.pulsewire.core.model.Item;
import com.pulsewire.core.model.Source;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable collector for coordinator and run tests.
 */
public class FakeCollector implements Collector {

    private final String id;
    private final Function<CollectRequest, CollectorResult> behavior;
    private final List<CollectRequest> requests = new CopyOnWriteArrayList<>();
    private List<String> credentials = List.of();
    private boolean requiresAny;

    public FakeCollector(String id, Function<CollectRequest, CollectorResult> behavior) {
        this.id = id;
        this.behavior = behavior;
    }

    public static FakeCollector returning(String id, Item... items) {
        List<Item> list = Arrays.asList(items);
        return new FakeCollector(id, request -> CollectorResult.of(list,
            List.of(Source.of(id + " source", "https://" + id + ".example.com"))));
    }

    /** Blocks until interrupted or cancelled, then returns one item that must never be merged. */
    public static FakeCollector hanging(String id) {
        return new FakeCollector(id, request -> {
            long until = System.currentTimeMillis() + 30_000;
            while (System.currentTimeMillis() < until && !request.isCancelled()) {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            return CollectorResult.of(List.of(TestItems.newsBuilder(id + "-late", "Late").build()), List.of());
        });
    }

    public FakeCollector withCredentials(boolean any, String... keys) {
        this.credentials = List.of(keys);
        this.requiresAny = any;
        return this;
    }

    public List<CollectRequest> requests() {
        return requests;
    }

    public int invocations() {
        return requests.size();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return "Fake " + id;
    }

    @Override
    public String type() {
        return "news";
    }

    @Override
    public List<String> requiredCredentials() {
        return credentials;
    }

    @Override
    public boolean requiresAny() {
        return requiresAny;
    }

    @Override
    public CollectorResult collect(CollectRequest request) {
        requests.add(request);
        return behavior.apply(request);
    }
}
