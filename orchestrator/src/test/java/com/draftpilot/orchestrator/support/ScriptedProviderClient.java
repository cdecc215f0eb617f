package com.draftpilot.orchestrator.support;

import com.draftpilot.orchestrator.provider.*;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * ProviderClient whose answers are scripted per model. Queued outcomes are
 * consumed first; after that the model's default responder is used.
 */
public class ScriptedProviderClient implements ProviderClient {

    private final Vendor  vendor;
    private final boolean configured;

    private final Map<String, Deque<Object>>              queued     = new ConcurrentHashMap<>();
    private final Map<String, Function<Prompt, Generation>> responders = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger>              calls      = new ConcurrentHashMap<>();
    private final List<Prompt>                            prompts    = new CopyOnWriteArrayList<>();

    public ScriptedProviderClient(Vendor vendor) {
        this(vendor, true);
    }

    public ScriptedProviderClient(Vendor vendor, boolean configured) {
        this.vendor     = vendor;
        this.configured = configured;
    }

    public ScriptedProviderClient respond(Backend backend, Function<Prompt, Generation> responder) {
        responders.put(backend.model(), responder);
        return this;
    }

    public ScriptedProviderClient respondText(Backend backend, String text) {
        return respond(backend, p -> new Generation(text, new TokenUsage(100, 200)));
    }

    /** Queue one outcome: a {@link Generation} or a RuntimeException to throw. */
    public synchronized ScriptedProviderClient then(Backend backend, Object outcome) {
        queued.computeIfAbsent(backend.model(), m -> new ArrayDeque<>()).add(outcome);
        return this;
    }

    public ScriptedProviderClient alwaysFail(Backend backend, ProviderException.Kind kind) {
        return respond(backend, p -> {
            throw new ProviderException(kind, vendor, "scripted " + kind);
        });
    }

    public int calls(Backend backend) {
        AtomicInteger n = calls.get(backend.model());
        return n == null ? 0 : n.get();
    }

    /** Every prompt received, in call order. */
    public List<Prompt> prompts() {
        return List.copyOf(prompts);
    }

    @Override
    public Vendor vendor() {
        return vendor;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public Generation generate(String model, Prompt prompt, GenerationParams params, Duration timeout) {
        calls.computeIfAbsent(model, m -> new AtomicInteger()).incrementAndGet();
        prompts.add(prompt);
        Object next;
        synchronized (this) {
            Deque<Object> q = queued.get(model);
            next = q == null ? null : q.poll();
        }
        if (next instanceof RuntimeException e) {
            throw e;
        }
        if (next instanceof Generation g) {
            return g;
        }
        Function<Prompt, Generation> responder = responders.get(model);
        if (responder == null) {
            throw new ProviderException(ProviderException.Kind.BAD_REQUEST, vendor, "no script for " + model);
        }
        return responder.apply(prompt);
    }
}
