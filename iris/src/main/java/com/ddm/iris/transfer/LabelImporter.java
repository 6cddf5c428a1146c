package com.ddm.iris.transfer;

import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.provider.LabelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 标签导入/导出（仅合并策略，不含文件解析）。
 *
 * <p><strong>合并规则：</strong>
 * <ul>
 *   <li>标签不存在：连同全部变体一起创建</li>
 *   <li>已校验的导入变体：覆盖同槽位的已有变体</li>
 *   <li>未校验的导入变体：仅在槽位为空时新增，不替换已有内容</li>
 * </ul>
 * 已存在标签的默认文案与默认语言保持不变。
 *
 * @author liyifei
 * @see LabelRecord
 * @since 1.0
 */
public class LabelImporter {

    private static final Logger log = LoggerFactory.getLogger(LabelImporter.class);

    private final LabelStore store;

    public LabelImporter(LabelStore store) {
        this.store = Objects.requireNonNull(store, "store required");
    }

    /**
     * 合并导入记录。
     *
     * @return 各类变更的计数
     */
    public ImportReport importLabels(Collection<LabelRecord> records) {
        ImportReport report = ImportReport.EMPTY;
        for (LabelRecord record : records) {
            report = report.plus(merge(record));
        }
        log.info("Imported {} label records: {}", records.size(), report);
        return report;
    }

    private ImportReport merge(LabelRecord record) {
        Label existing = store.getLabel(record.ref());
        if (existing == null) {
            Label built = record.toLabel();
            Label created = store.upsertIfAbsent(built);
            if (created == built) {
                log.debug("Created label {} from import", record.ref());
                return new ImportReport(1, 0, 0, 0);
            }
            // 并发创建，按已存在标签合并
            existing = created;
        }
        Label merged = existing;
        int overwritten = 0;
        int added = 0;
        int skipped = 0;
        for (LocalizedLabel incoming : record.variants()) {
            LocalizedLabel current = merged.find(incoming.slot());
            if (current == null) {
                merged = merged.withVariant(incoming);
                added++;
            } else if (incoming.validated()) {
                if (!current.equals(incoming)) {
                    merged = merged.withVariant(incoming);
                    overwritten++;
                }
            } else {
                skipped++;
            }
        }
        if (!merged.equals(existing)) {
            store.saveLabel(merged);
        }
        log.debug("Merged label {}: overwritten={}, added={}, skipped={}", record.ref(), overwritten, added, skipped);
        return new ImportReport(0, overwritten, added, skipped);
    }

    /**
     * 导出指定标签，不存在的引用被忽略。
     */
    public List<LabelRecord> export(Collection<LabelRef> refs) {
        List<LabelRecord> records = new ArrayList<>(refs.size());
        for (LabelRef ref : refs) {
            Label label = store.getLabel(ref);
            if (label != null) {
                records.add(LabelRecord.from(label));
            }
        }
        return records;
    }
}
