package org.ifcserver.ifc.model;

/**
 * 模型数据归属信息（写入 OwnerHistory 与 STEP 头部）。
 * <p>
 * 只是静态元数据，对建模行为没有影响。
 *
 * @param developersName          应用开发者（组织）名称
 * @param applicationName         应用全名
 * @param applicationId           应用标识
 * @param applicationVersion      应用版本
 * @param editorsFamilyName       编辑者姓
 * @param editorsGivenName        编辑者名
 * @param editorsOrganisationName 编辑者所属组织
 */
public record EditorCredentials(
        String developersName,
        String applicationName,
        String applicationId,
        String applicationVersion,
        String editorsFamilyName,
        String editorsGivenName,
        String editorsOrganisationName
) {
}
