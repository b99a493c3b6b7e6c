package com.ryuqq.changetracker.adapter.inmemory.render;

import com.ryuqq.changetracker.core.debug.DebugStringOptions;
import com.ryuqq.changetracker.core.entry.EntityState;
import com.ryuqq.changetracker.core.entry.TrackedEntry;
import com.ryuqq.changetracker.core.metadata.EntityType;
import com.ryuqq.changetracker.core.metadata.Key;
import com.ryuqq.changetracker.core.metadata.Property;
import com.ryuqq.changetracker.core.spi.EntryRenderer;

import java.lang.reflect.Array;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Line-oriented entry rendering.
 *
 * <p><strong>출력 형식:</strong></p>
 * <pre>
 * Order {Id: 1} Modified
 *   Id: 1 PK
 *   Name: 'new' Modified Originally 'old'
 * Tag (Keyless) Added
 * </pre>
 *
 * <ul>
 *   <li>첫 줄: entity type, key 값, 상태</li>
 *   <li>property 줄: {@link DebugStringOptions#includeProperties()}일 때만, 2칸 들여쓰기</li>
 *   <li>값: null → {@code <null>}, String → {@code 'x'}, byte[] → {@code 0x0A0B}, 배열 → {@code [1, 2]}</li>
 * </ul>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 */
public final class DefaultEntryRenderer implements EntryRenderer {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    @Override
    public String toDebugString(TrackedEntry entry, DebugStringOptions options) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        EntityType entityType = entry.getEntityType();
        Key primaryKey = entityType.findPrimaryKey();

        StringBuilder builder = new StringBuilder(entityType.getName()).append(' ');
        if (primaryKey == null) {
            builder.append("(Keyless)");
        } else {
            builder.append('{');
            List<Property> keyProperties = primaryKey.getProperties();
            for (int i = 0; i < keyProperties.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                Property keyProperty = keyProperties.get(i);
                builder.append(keyProperty.getName()).append(": ").append(format(entry.getCurrentValue(keyProperty)));
            }
            builder.append('}');
        }
        builder.append(' ').append(stateName(entry.getEntityState()));

        if (options.includeProperties()) {
            for (Property property : entityType.getProperties()) {
                builder.append('\n').append("  ").append(property.getName()).append(": ")
                    .append(format(entry.getCurrentValue(property)));
                if (primaryKey != null && primaryKey.getProperties().contains(property)) {
                    builder.append(" PK");
                }
                if (entry.isModified(property)) {
                    builder.append(" Modified");
                    Object original = entry.getOriginalValue(property);
                    if (!Objects.deepEquals(original, entry.getCurrentValue(property))) {
                        builder.append(" Originally ").append(format(original));
                    }
                }
            }
        }
        return builder.toString();
    }

    static String format(Object value) {
        if (value == null) {
            return "<null>";
        }
        if (value instanceof String) {
            return "'" + value + "'";
        }
        if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            StringBuilder hex = new StringBuilder("0x");
            for (byte b : bytes) {
                hex.append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
            return hex.toString();
        }
        if (value.getClass().isArray()) {
            StringBuilder elements = new StringBuilder("[");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (i > 0) {
                    elements.append(", ");
                }
                elements.append(format(Array.get(value, i)));
            }
            return elements.append(']').toString();
        }
        return String.valueOf(value);
    }

    private static String stateName(EntityState state) {
        String name = state.name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
