package com.williamcallahan.setforge.service.pipeline;

import com.williamcallahan.setforge.config.AppProperties;
import com.williamcallahan.setforge.domain.work.WorkItem;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Renders the prompt for a work item by substituting {@code {content}} and {@code {id}}.
 */
@Component
public class GenerationPromptTemplate {

    static final String CONTENT_PLACEHOLDER = "{content}";
    static final String ID_PLACEHOLDER = "{id}";

    private final String template;

    @Autowired
    public GenerationPromptTemplate(AppProperties appProperties) {
        this(appProperties.getGeneration().getPromptTemplate());
    }

    GenerationPromptTemplate(String template) {
        if (template == null || !template.contains(CONTENT_PLACEHOLDER)) {
            throw new IllegalArgumentException("Prompt template must contain " + CONTENT_PLACEHOLDER);
        }
        this.template = template;
    }

    public String render(WorkItem item) {
        return template.replace(ID_PLACEHOLDER, item.id()).replace(CONTENT_PLACEHOLDER, item.payload());
    }
}
