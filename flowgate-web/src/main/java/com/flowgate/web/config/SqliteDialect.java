package com.flowgate.web.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.relational.core.dialect.AbstractDialect;
import org.springframework.data.relational.core.dialect.LimitClause;
import org.springframework.data.relational.core.dialect.LockClause;
import org.springframework.data.relational.core.sql.IdentifierProcessing;
import org.springframework.data.relational.core.sql.LockOptions;

import java.util.Collection;
import java.util.List;

/**
 * Spring Data JDBC 的 SQLite 方言。
 * <p>
 * 分页使用 LIMIT/OFFSET；SQLite 没有行锁，锁子句为空；标识符不加引号也不转大写。
 * SQLite 没有布尔类型，INTEGER 0/1 读回 Boolean 字段时需要转换。
 */
public class SqliteDialect extends AbstractDialect {

    public static final SqliteDialect INSTANCE = new SqliteDialect();

    private static final LimitClause LIMIT_CLAUSE = new LimitClause() {

        @Override
        public String getLimit(long limit) {
            return "LIMIT " + limit;
        }

        @Override
        public String getOffset(long offset) {
            // SQLite 的 OFFSET 必须跟在 LIMIT 之后，-1 表示不限
            return "LIMIT -1 OFFSET " + offset;
        }

        @Override
        public String getLimitOffset(long limit, long offset) {
            return "LIMIT " + limit + " OFFSET " + offset;
        }

        @Override
        public Position getClausePosition() {
            return Position.AFTER_ORDER_BY;
        }
    };

    private static final LockClause NO_LOCK = new LockClause() {

        @Override
        public String getLock(LockOptions lockOptions) {
            return "";
        }

        @Override
        public Position getClausePosition() {
            return Position.AFTER_ORDER_BY;
        }
    };

    protected SqliteDialect() {
    }

    @Override
    public LimitClause limit() {
        return LIMIT_CLAUSE;
    }

    @Override
    public LockClause lock() {
        return NO_LOCK;
    }

    @Override
    public IdentifierProcessing getIdentifierProcessing() {
        return IdentifierProcessing.NONE;
    }

    @Override
    public Collection<Object> getConverters() {
        return List.of(NumberToBooleanConverter.INSTANCE);
    }

    @ReadingConverter
    enum NumberToBooleanConverter implements Converter<Number, Boolean> {

        INSTANCE;

        @Override
        public Boolean convert(Number source) {
            return source.intValue() != 0;
        }
    }
}
