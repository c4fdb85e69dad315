package jump.email.sorter.service;

import jump.email.sorter.entity.Category;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of configured categories. Lookups ignore case.
 */
public class CategoryRegistry {
    private final Map<String, Category> byName = new LinkedHashMap<>();

    public CategoryRegistry(List<Category> categories) {
        for (Category category : categories) {
            if (category.getName() == null || category.getName().isBlank()) {
                throw new IllegalStateException("Category without a name in configuration");
            }
            String key = key(category.getName());
            if (Category.UNKNOWN.equals(key)) {
                throw new IllegalStateException(Category.UNKNOWN + " is reserved and cannot be configured");
            }
            if (byName.putIfAbsent(key, category) != null) {
                throw new IllegalStateException("Duplicate category " + category.getName());
            }
        }
    }

    public List<Category> all() {
        return Collections.unmodifiableList(new ArrayList<>(byName.values()));
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        byName.values().forEach(category -> names.add(category.getName()));
        return names;
    }

    public Optional<Category> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(key(name)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * @return the folder a category's messages are moved to, empty for UNKNOWN and folder-less categories
     */
    public Optional<String> destinationOf(String name) {
        return find(name).filter(Category::hasDestination).map(Category::getFolder);
    }

    private static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
