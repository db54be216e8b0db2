package xyz.firestige.clouddeploy.domain.config;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 数据库选择：本地文件（SQLite）或托管数据库
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DatabaseConfig.LocalDatabase.class, name = "local"),
        @JsonSubTypes.Type(value = DatabaseConfig.ManagedDatabase.class, name = "managed")
})
public sealed interface DatabaseConfig permits DatabaseConfig.LocalDatabase, DatabaseConfig.ManagedDatabase {

    /**
     * 写入 infra 变量时使用的 database_type 取值
     */
    String terraformType();

    static DatabaseConfig local() {
        return new LocalDatabase();
    }

    record LocalDatabase() implements DatabaseConfig {
        @Override
        public String terraformType() {
            return "sqlite";
        }
    }

    /**
     * @param instanceClass    实例规格（db.t3.micro / B_Standard_B1ms / db-f1-micro）
     * @param storageGb        存储大小
     * @param highAvailability 多可用区 / 高可用
     */
    record ManagedDatabase(String instanceClass, int storageGb, boolean highAvailability) implements DatabaseConfig {
        @Override
        public String terraformType() {
            return "postgresql";
        }
    }
}
