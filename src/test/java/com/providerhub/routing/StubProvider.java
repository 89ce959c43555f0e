package com.providerhub.routing;

import com.providerhub.providers.ChatChunk;
import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.ChatResponse;
import com.providerhub.providers.ModelProvider;
import com.providerhub.providers.TokenUsage;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Adapter without optional capabilities; fails its first {@code failUntil} calls. */
class StubProvider implements ModelProvider {

    final String name;
    final AtomicInteger calls = new AtomicInteger();
    final AtomicInteger streamCalls = new AtomicInteger();
    final List<ChatRequest> requests = new CopyOnWriteArrayList<>();

    int failUntil;
    Supplier<RuntimeException> error = () -> new RuntimeException("503 unavailable");
    ChatResponse response;
    List<ChatChunk> chunks = List.of();
    int streamFailAfter = -1;

    StubProvider(String name) {
        this.name = name;
    }

    StubProvider failing(int failUntil, Supplier<RuntimeException> error) {
        this.failUntil = failUntil;
        this.error = error;
        return this;
    }

    StubProvider alwaysFailing() {
        return failing(Integer.MAX_VALUE, () -> new RuntimeException("500 down from " + name));
    }

    StubProvider responding(ChatResponse response) {
        this.response = response;
        return this;
    }

    StubProvider streaming(List<ChatChunk> chunks, int failAfter) {
        this.chunks = List.copyOf(chunks);
        this.streamFailAfter = failAfter;
        return this;
    }

    @Override
    public ChatResponse chat(ChatRequest request) {
        requests.add(request);
        int attempt = calls.incrementAndGet();
        if (attempt <= failUntil) throw error.get();
        if (response != null) return response;
        return new ChatResponse("id-" + name, request.model(), 1L, "ok from " + name, "stop",
                TokenUsage.of(10, 5), List.of());
    }

    @Override
    public Iterator<ChatChunk> chatStream(ChatRequest request) {
        requests.add(request);
        streamCalls.incrementAndGet();
        var source = new ArrayList<>(chunks);
        return new Iterator<>() {
            int emitted;

            @Override
            public boolean hasNext() {
                if (streamFailAfter >= 0 && emitted >= streamFailAfter) {
                    throw new RuntimeException("stream broken on " + name);
                }
                return emitted < source.size();
            }

            @Override
            public ChatChunk next() {
                if (!hasNext()) throw new NoSuchElementException();
                return source.get(emitted++);
            }
        };
    }
}
