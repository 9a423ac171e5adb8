package org.ifcserver.ifc.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * “一对多”关系实体的基类：一个关系端（relating）对应若干被关联对象（related）。
 * <p>
 * 被关联对象列表只能在事务内追加（{@link #attach(IfcModel, IfcRoot)}），事务回滚时追加会被撤销。
 *
 * @param <T> 被关联对象类型
 */
public abstract class IfcRelationship<T extends IfcRoot> extends IfcRoot {

    private final List<T> related = new ArrayList<>();

    protected IfcRelationship(String globalId, IfcResources.OwnerHistory ownerHistory) {
        super(globalId, ownerHistory, null, null);
    }

    public List<T> getRelated() {
        return Collections.unmodifiableList(related);
    }

    public void attach(IfcModel model, T element) {
        IfcTransaction txn = model.requireTransaction();
        related.add(element);
        txn.onRollback(() -> removeByIdentity(element));
    }

    protected List<Object> relatedAsArgument() {
        return new ArrayList<>(related);
    }

    private void removeByIdentity(T element) {
        for (int i = related.size() - 1; i >= 0; i--) {
            if (related.get(i) == element) {
                related.remove(i);
                return;
            }
        }
    }
}
