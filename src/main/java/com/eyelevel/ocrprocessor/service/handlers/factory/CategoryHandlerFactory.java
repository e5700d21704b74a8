package com.eyelevel.ocrprocessor.service.handlers.factory;

import com.eyelevel.ocrprocessor.model.FileCategory;
import com.eyelevel.ocrprocessor.service.handlers.CategoryHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A factory for retrieving the {@link CategoryHandler} registered for a {@link FileCategory}.
 */
@Service
@Slf4j
public class CategoryHandlerFactory {

    private final Map<FileCategory, CategoryHandler> handlers = new EnumMap<>(FileCategory.class);

    public CategoryHandlerFactory(List<CategoryHandler> handlers) {
        for (CategoryHandler handler : handlers) {
            final CategoryHandler previous = this.handlers.put(handler.category(), handler);
            if (previous != null) {
                throw new IllegalStateException(String.format("Both %s and %s handle category '%s'.",
                        previous.getClass().getSimpleName(), handler.getClass().getSimpleName(),
                        handler.category().getValue()));
            }
        }
        log.info("CategoryHandlerFactory initialized with {} available handlers.", this.handlers.size());
    }

    public Optional<CategoryHandler> getHandler(FileCategory category) {
        final Optional<CategoryHandler> handler = Optional.ofNullable(handlers.get(category));
        log.debug("Searching for handler for category '{}'. Found: {}", category,
                handler.map(h -> h.getClass().getSimpleName()).orElse("None"));
        return handler;
    }
}
