package com.agentic.examples;

import com.agentic.core.model.IntentType;
import com.agentic.engine.classifier.KeywordIntentClassifier;
import com.agentic.worker.llm.LanguageModelGateway;
import com.agentic.worker.llm.LlmMessage;
import com.agentic.worker.llm.LlmRequest;
import com.agentic.worker.llm.LlmResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offline language model returning canned answers.
 *
 * Intent questions are answered with the keyword classifier's verdict. Work requests are
 * answered with a JSON document holding {@code code}, {@code language} and
 * {@code explanation}, picked by simple pattern matching on the last user message.
 */
public class MockLanguageModelGateway implements LanguageModelGateway {

    private static final Logger log = LoggerFactory.getLogger(MockLanguageModelGateway.class);

    static final String MODEL = "mock-model";

    private static final String FASTAPI_CODE = String.join("\n",
        "from fastapi import FastAPI",
        "from pydantic import BaseModel",
        "",
        "app = FastAPI()",
        "",
        "class Item(BaseModel):",
        "    name: str",
        "    description: str = None",
        "",
        "@app.get(\"/\")",
        "async def root():",
        "    return {\"message\": \"Hello World\"}",
        "",
        "@app.post(\"/items/\")",
        "async def create_item(item: Item):",
        "    return item");

    private static final String REACT_CODE = String.join("\n",
        "import React, { useState } from 'react';",
        "",
        "function App() {",
        "  const [count, setCount] = useState(0);",
        "",
        "  return (",
        "    <div className=\"App\">",
        "      <h1>React Counter</h1>",
        "      <p>Count: {count}</p>",
        "      <button onClick={() => setCount(count + 1)}>Increment</button>",
        "    </div>",
        "  );",
        "}",
        "",
        "export default App;");

    private static final String FIBONACCI_CODE = String.join("\n",
        "def calculate_fibonacci(n):",
        "    \"\"\"Calculate the nth Fibonacci number.\"\"\"",
        "    if n <= 1:",
        "        return n",
        "    return calculate_fibonacci(n - 1) + calculate_fibonacci(n - 2)");

    private final ObjectMapper objectMapper;
    private final KeywordIntentClassifier intents = new KeywordIntentClassifier();
    private final Duration latency;
    private final AtomicLong calls = new AtomicLong();

    public MockLanguageModelGateway() {
        this(Duration.ZERO);
    }

    public MockLanguageModelGateway(Duration latency) {
        this(latency, new ObjectMapper());
    }

    public MockLanguageModelGateway(Duration latency, ObjectMapper objectMapper) {
        this.latency = latency;
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<LlmResponse> complete(LlmRequest request) {
        calls.incrementAndGet();
        String content = isIntentQuestion(request)
            ? intents.classify(request.lastUserContent(), null).value()
            : answer(request.lastUserContent());
        LlmResponse response = new LlmResponse(content, MODEL, estimateTokens(request, content), "stop");
        log.debug("Mock completion #{}: {} token(s)", calls.get(), response.tokensUsed());

        if (latency.isZero()) {
            return CompletableFuture.completedFuture(response);
        }
        return CompletableFuture.supplyAsync(() -> response,
            CompletableFuture.delayedExecutor(latency.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public String provider() {
        return "mock";
    }

    public long callCount() {
        return calls.get();
    }

    private String answer(String userMessage) {
        String text = userMessage.toLowerCase(Locale.ROOT);
        if (text.contains("fastapi")) {
            return document(FASTAPI_CODE, "python",
                "Created a basic FastAPI application with a root endpoint and item creation endpoint.");
        }
        if (text.contains("react")) {
            return document(REACT_CODE, "javascript", "Created a basic React component with state management.");
        }
        if (text.contains("function") && text.contains("python")) {
            return document(FIBONACCI_CODE, "python", "Created a recursive Fibonacci function.");
        }
        return document("# Generated code based on your request\nprint('Hello, AI-generated code!')", "python",
            "Generated a simple Python script based on your request.");
    }

    private String document(String code, String language, String explanation) {
        ObjectNode node = objectMapper.createObjectNode()
            .put("code", code)
            .put("language", language)
            .put("explanation", explanation);
        return node.toString();
    }

    private static boolean isIntentQuestion(LlmRequest request) {
        return request.messages().stream()
            .filter(message -> "system".equals(message.role()))
            .map(LlmMessage::content)
            .anyMatch(content -> content.startsWith("You classify") && content.contains(IntentType.PROJECT_SETUP.value()));
    }

    // Roughly four characters per token.
    private static long estimateTokens(LlmRequest request, String content) {
        long characters = content.length();
        for (LlmMessage message : request.messages()) {
            characters += message.content().length();
        }
        return Math.max(1, characters / 4);
    }
}
