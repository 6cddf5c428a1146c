package com.ddm.iris.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * 通过 SPI 加载 {@link LabelStore} 实现。
 *
 * @author liyifei
 * @since 1.0
 */
public final class LabelStores {

    private static final Logger log = LoggerFactory.getLogger(LabelStores.class);

    private LabelStores() {
    }

    /**
     * 按类型查找（不区分大小写）并初始化存储。
     *
     * @param type    存储类型，如 "memory"、"jdbc"
     * @param options 初始化参数，可为 null
     * @return 已初始化的存储
     * @throws IllegalStateException 如果找不到对应类型或初始化失败
     */
    public static LabelStore load(String type, Map<String, String> options) {
        Objects.requireNonNull(type, "store type cannot be null");
        ServiceLoader<LabelStore> loader =
                ServiceLoader.load(LabelStore.class, Thread.currentThread().getContextClassLoader());
        List<String> availableTypes = new ArrayList<>();
        LabelStore found = null;
        for (LabelStore store : loader) {
            String storeType = store.type();
            if (type.equalsIgnoreCase(storeType)) {
                found = store;
                break;
            }
            availableTypes.add(storeType);
        }
        if (found != null) {
            try {
                found.init(options == null ? Map.of() : options);
                log.info("LabelStore '{}' initialized successfully via SPI", type);
                return found;
            } catch (Exception e) {
                String message = String.format("Failed to initialize LabelStore '%s'", type);
                log.error(message, e);
                throw new IllegalStateException(message, e);
            }
        }
        String typesList = availableTypes.isEmpty() ? "none" : String.join(", ", availableTypes);
        String message = String.format("No LabelStore found via SPI for type '%s'. Available types: %s",
                type, typesList);
        log.error(message);
        throw new IllegalStateException(message);
    }
}
