package org.dxworks.dacframe.model.sql;

public enum ObjectKind {
    TABLE,
    VIEW,
    PROCEDURE,
    FUNCTION,
    TRIGGER,
    SYNONYM,
    SEQUENCE,
    EXTERNAL,
    UNKNOWN
}
