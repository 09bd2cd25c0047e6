/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.facebook.presto.federation.datasource.jdbc;

import com.facebook.presto.federation.paging.Acceptor;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Reads one result set column into its acceptor.
 */
final class JdbcColumnReader
{
    private JdbcColumnReader()
    {
    }

    static void read(ResultSet resultSet, int column, Acceptor acceptor)
            throws SQLException
    {
        Object value;
        switch (acceptor.getKind()) {
            case BOOLEAN:
                value = resultSet.getBoolean(column);
                break;
            case BYTE:
                value = resultSet.getByte(column);
                break;
            case SHORT:
                value = resultSet.getShort(column);
                break;
            case INT:
                value = resultSet.getInt(column);
                break;
            case LONG:
                value = resultSet.getLong(column);
                break;
            case BIG_INTEGER:
                BigDecimal decimal = resultSet.getBigDecimal(column);
                value = decimal == null ? null : decimal.toBigIntegerExact();
                break;
            case FLOAT:
                value = resultSet.getFloat(column);
                break;
            case DOUBLE:
                value = resultSet.getDouble(column);
                break;
            case DECIMAL:
                value = resultSet.getBigDecimal(column);
                break;
            case STRING:
                value = resultSet.getString(column);
                break;
            case BYTES:
                value = resultSet.getBytes(column);
                break;
            case DATE:
                value = resultSet.getObject(column, LocalDate.class);
                break;
            case TIMESTAMP:
                value = resultSet.getObject(column, LocalDateTime.class);
                break;
            default:
                throw new IllegalStateException("Unexpected kind: " + acceptor.getKind());
        }

        if (resultSet.wasNull()) {
            acceptor.setNull();
        }
        else {
            acceptor.set(value);
        }
    }
}
