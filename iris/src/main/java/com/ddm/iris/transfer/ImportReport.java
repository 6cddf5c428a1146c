package com.ddm.iris.transfer;

/**
 * 导入结果统计。
 *
 * @param created     新建的标签数
 * @param overwritten 被已校验变体覆盖的变体数
 * @param added       新增到空槽位的变体数
 * @param skipped     因槽位已有内容而跳过的未校验变体数
 * @author liyifei
 */
public record ImportReport(int created, int overwritten, int added, int skipped) {

    public static final ImportReport EMPTY = new ImportReport(0, 0, 0, 0);

    ImportReport plus(ImportReport other) {
        return new ImportReport(created + other.created, overwritten + other.overwritten,
                added + other.added, skipped + other.skipped);
    }
}
