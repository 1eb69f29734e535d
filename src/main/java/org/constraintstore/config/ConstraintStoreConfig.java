package org.constraintstore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 约束存储的全局默认配置。
 * 每一项都可以通过 {@code -Dconstraintstore.<key>=<value>} 在启动时覆盖。
 */
public class ConstraintStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintStoreConfig.class);

    public static final String PROPERTY_PREFIX = "constraintstore.";

    // 未指定名字时的默认变量名前缀
    public static String boolPrefix = stringProperty("boolPrefix", "B");
    public static String bitVecPrefix = stringProperty("bitVecPrefix", "BV");
    public static String arrayPrefix = stringProperty("arrayPrefix", "A");

    // 迁移时本地名字冲突，以 "<原名><后缀>" 为种子重新取名
    public static String migratedSuffix = stringProperty("migratedSuffix", "_migrated");

    // newArray 的默认位宽
    public static int arrayIndexBits = intProperty("arrayIndexBits", 32);
    public static int arrayValueBits = intProperty("arrayValueBits", 8);

    // 辅助绑定名模板，%d 为序号
    public static String auxBindingFormat = stringProperty("auxBindingFormat", "!aux_%d!");

    // toText 默认是否做常量替换
    public static boolean replaceConstants = booleanProperty("replaceConstants", true);

    private ConstraintStoreConfig() {
    }

    private static String stringProperty(String key, String defaultValue) {
        return System.getProperty(PROPERTY_PREFIX + key, defaultValue);
    }

    private static int intProperty(String key, int defaultValue) {
        String value = System.getProperty(PROPERTY_PREFIX + key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("配置项 {}{} 的值 '{}' 不是整数，使用默认值 {}", PROPERTY_PREFIX, key, value, defaultValue);
            return defaultValue;
        }
    }

    private static boolean booleanProperty(String key, boolean defaultValue) {
        String value = System.getProperty(PROPERTY_PREFIX + key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }
}
