package com.williamcallahan.setforge.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.work.WorkItem;
import org.junit.jupiter.api.Test;

class GenerationPromptTemplateTest {

    @Test
    void substitutesIdAndContent() {
        GenerationPromptTemplate template = new GenerationPromptTemplate("[{id}] Summarize:\n{content}");

        String prompt = template.render(WorkItem.inMemory("docs/intro.md", "Java records are final."));

        assertEquals("[docs/intro.md] Summarize:\nJava records are final.", prompt);
    }

    @Test
    void defaultTemplateEmbedsPayload() {
        GenerationPromptTemplate template = new GenerationPromptTemplate(new AppProperties());

        assertTrue(template.render(WorkItem.inMemory("x", "payload text")).endsWith("payload text"));
    }

    @Test
    void templateWithoutContentPlaceholderIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GenerationPromptTemplate("no placeholder"));
    }
}
