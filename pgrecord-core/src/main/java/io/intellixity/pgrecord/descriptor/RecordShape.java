package io.intellixity.pgrecord.descriptor;

import java.lang.reflect.Constructor;
import java.util.List;

/** Reflection result shared by descriptor and decoder synthesis. */
record RecordShape<T>(Class<T> type,
                      List<ColumnRef> components,
                      List<Boolean> primaryKeyMarks,
                      Constructor<T> canonicalConstructor) {
}
