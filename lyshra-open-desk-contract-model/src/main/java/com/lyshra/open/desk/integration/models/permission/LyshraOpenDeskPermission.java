package com.lyshra.open.desk.integration.models.permission;

import com.lyshra.open.desk.integration.contract.permission.ILyshraOpenDeskPermission;
import lombok.Data;

/**
 * A read/write grant. {@link #merge} is an OR: commutative, associative, with {@link #NONE} as identity.
 */
@Data
public class LyshraOpenDeskPermission implements ILyshraOpenDeskPermission {
    public static final LyshraOpenDeskPermission NONE = new LyshraOpenDeskPermission(false, false);
    public static final LyshraOpenDeskPermission FULL = new LyshraOpenDeskPermission(true, true);

    private final boolean read;
    private final boolean write;

    public static LyshraOpenDeskPermission of(boolean read, boolean write) {
        if (read && write) {
            return FULL;
        }
        return read || write ? new LyshraOpenDeskPermission(read, write) : NONE;
    }

    public static LyshraOpenDeskPermission copyOf(ILyshraOpenDeskPermission permission) {
        return permission == null ? NONE : of(permission.isRead(), permission.isWrite());
    }

    public LyshraOpenDeskPermission merge(ILyshraOpenDeskPermission other) {
        return merge(this, other);
    }

    public static LyshraOpenDeskPermission merge(ILyshraOpenDeskPermission a, ILyshraOpenDeskPermission b) {
        if (a == null) {
            return copyOf(b);
        }
        if (b == null) {
            return copyOf(a);
        }
        return of(a.isRead() || b.isRead(), a.isWrite() || b.isWrite());
    }
}
