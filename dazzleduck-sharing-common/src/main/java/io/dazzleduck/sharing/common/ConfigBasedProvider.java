package io.dazzleduck.sharing.common;

import com.typesafe.config.Config;

/**
 * Implementation chosen by the {@code class} key of a config section, instantiated through its
 * no-argument constructor and then handed that section.
 */
public interface ConfigBasedProvider {

    String CLASS_KEY = "class";

    static <T extends ConfigBasedProvider> T load(Config config, String prefixKey, T defaultObject, Class<T> type) throws Exception {
        var innerConfig = config.getConfig(prefixKey);
        if (innerConfig.hasPath(CLASS_KEY)) {
            var clazz = innerConfig.getString(CLASS_KEY);
            var constructor = Class.forName(clazz).asSubclass(type).getConstructor();
            T object = constructor.newInstance();
            object.setConfig(innerConfig);
            return object;
        } else {
            defaultObject.setConfig(innerConfig);
            return defaultObject;
        }
    }

    void setConfig(Config config);
}
