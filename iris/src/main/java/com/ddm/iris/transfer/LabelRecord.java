package com.ddm.iris.transfer;

import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 导入/导出的标签记录。文件格式的解析由调用方负责。
 *
 * @author liyifei
 */
public record LabelRecord(LabelRef ref,
                          String category,
                          Locale defaultLocale,
                          String defaultText,
                          List<LocalizedLabel> variants) {

    public LabelRecord {
        Objects.requireNonNull(ref, "ref cannot be null");
        Objects.requireNonNull(defaultLocale, "defaultLocale cannot be null");
        Objects.requireNonNull(defaultText, "defaultText cannot be null");
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public static LabelRecord from(Label label) {
        return new LabelRecord(label.ref(), label.category(), label.defaultLocale(), label.defaultText(),
                label.variants());
    }

    Label toLabel() {
        return new Label(ref, category, defaultLocale, defaultText, variants);
    }
}
