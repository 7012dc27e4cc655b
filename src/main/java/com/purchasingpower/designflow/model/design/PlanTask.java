package com.purchasingpower.designflow.model.design;

import java.util.ArrayList;
import java.util.List;

/**
 * One numbered task of the implementation plan, rendered as a checkbox list.
 */
public record PlanTask(int number, String title, List<Item> items) {

    /**
     * A checkbox line, optionally followed by indented notes.
     */
    public record Item(String text, List<String> notes) {

        public static Item of(String text) {
            return new Item(text, List.of());
        }
    }

    public static Builder builder(int number, String title) {
        return new Builder(number, title);
    }

    public static final class Builder {

        private final int number;
        private final String title;
        private final List<Item> items = new ArrayList<>();

        private Builder(int number, String title) {
            this.number = number;
            this.title = title;
        }

        public Builder item(String text) {
            items.add(Item.of(text));
            return this;
        }

        public Builder item(String text, List<String> notes) {
            items.add(new Item(text, List.copyOf(notes)));
            return this;
        }

        /**
         * Appends a note to the last item.
         */
        public Builder note(String note) {
            if (items.isEmpty()) {
                throw new IllegalStateException("No item to attach note to");
            }
            Item last = items.remove(items.size() - 1);
            List<String> notes = new ArrayList<>(last.notes());
            notes.add(note);
            items.add(new Item(last.text(), List.copyOf(notes)));
            return this;
        }

        public PlanTask build() {
            return new PlanTask(number, title, List.copyOf(items));
        }
    }
}
