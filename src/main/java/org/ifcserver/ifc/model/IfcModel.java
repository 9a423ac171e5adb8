package org.ifcserver.ifc.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 内存中的 IFC 建筑模型（实例集合 + 头部信息 + 单写者事务）。
 * <p>
 * 并发约定：
 * <ul>
 *   <li>写：同一时刻只允许一个事务。写锁在事务期间一直持有；事务进行中再开事务会立即失败
 *       （{@link InvalidModelStateException}），不会排队等待。</li>
 *   <li>读：{@link #instances()} 等查询持有读锁，其他线程看不到进行中的事务；事务所在线程可以读到自己的修改。</li>
 * </ul>
 * <p>
 * 所有实体都必须先通过 {@link #newInstance(IfcEntity)} 注册（分配 {@code #label}）才能被关系引用。
 */
public class IfcModel {

    public static final String SCHEMA = "IFC4";

    private static final Logger log = LoggerFactory.getLogger(IfcModel.class);

    private final String projectName;
    private final EditorCredentials credentials;
    private final IfcModelHeader header;

    private final List<IfcEntity> instances = new ArrayList<>();
    private final Map<IfcEntity, Integer> labels = new IdentityHashMap<>();
    private int nextLabel = 1;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile IfcTransaction activeTransaction;

    public IfcModel(String projectName, EditorCredentials credentials, IfcModelHeader header) {
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("projectName 不能为空");
        }
        this.projectName = projectName;
        this.credentials = credentials;
        this.header = header;
    }

    public String getProjectName() {
        return projectName;
    }

    /**
     * 保存时使用的文件名：{@code <projectName>.ifc}。
     */
    public String getFileName() {
        return projectName + ".ifc";
    }

    public String getSchema() {
        return SCHEMA;
    }

    public EditorCredentials getCredentials() {
        return credentials;
    }

    public IfcModelHeader getHeader() {
        return header;
    }

    // ------------------------------------------------------------------
    // 事务
    // ------------------------------------------------------------------

    public IfcTransaction beginTransaction(String name) {
        IfcTransaction current = activeTransaction;
        if (current != null) {
            throw new InvalidModelStateException("模型已有进行中的事务“" + current.getName() + "”，不支持嵌套/并发事务：" + name);
        }
        if (!lock.writeLock().tryLock()) {
            throw new InvalidModelStateException("模型正被其他线程读取或修改，无法开启事务：" + name);
        }
        IfcTransaction txn = new IfcTransaction(this, name);
        activeTransaction = txn;
        log.debug("Begin transaction '{}'", name);
        return txn;
    }

    /**
     * 在一个事务中执行 {@code body}：正常返回即提交，抛出异常则整体回滚并原样抛出。
     * {@code body} 内已显式回滚的事务不再提交。
     */
    public <T> T runInTransaction(String name, Function<IfcModel, T> body) {
        try (IfcTransaction txn = beginTransaction(name)) {
            T result = body.apply(this);
            if (txn.isActive()) {
                txn.commit();
            }
            return result;
        }
    }

    public Optional<IfcTransaction> currentTransaction() {
        return Optional.ofNullable(activeTransaction);
    }

    IfcTransaction requireTransaction() {
        IfcTransaction txn = activeTransaction;
        if (txn == null || !txn.isOwnedByCurrentThread()) {
            throw new InvalidModelStateException("模型修改必须在事务内进行");
        }
        return txn;
    }

    void endTransaction(IfcTransaction txn, boolean committed) {
        if (activeTransaction != txn) {
            return;
        }
        activeTransaction = null;
        lock.writeLock().unlock();
        if (committed) {
            log.debug("Committed transaction '{}' ({} instances)", txn.getName(), instances.size());
        } else {
            log.debug("Rolled back transaction '{}'", txn.getName());
        }
    }

    // ------------------------------------------------------------------
    // 实例集合
    // ------------------------------------------------------------------

    /**
     * 注册新实体并分配 STEP 标签；必须在当前线程的事务内调用。
     */
    public <T extends IfcEntity> T newInstance(T entity) {
        IfcTransaction txn = requireTransaction();
        if (labels.containsKey(entity)) {
            throw new IllegalArgumentException("实体已注册，不能重复注册：" + entity.stepType());
        }
        int label = nextLabel++;
        labels.put(entity, label);
        instances.add(entity);
        txn.onRollback(() -> unregister(entity));
        return entity;
    }

    private void unregister(IfcEntity entity) {
        labels.remove(entity);
        for (int i = instances.size() - 1; i >= 0; i--) {
            if (instances.get(i) == entity) {
                instances.remove(i);
                break;
            }
        }
        nextLabel--;
    }

    /**
     * 返回实体的 STEP 标签；未注册时返回 -1。
     */
    public int labelOf(IfcEntity entity) {
        lock.readLock().lock();
        try {
            Integer label = labels.get(entity);
            return label == null ? -1 : label;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(IfcEntity entity) {
        return labelOf(entity) > 0;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return instances.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 按注册顺序返回实例快照。
     */
    public List<IfcEntity> instances() {
        lock.readLock().lock();
        try {
            return List.copyOf(instances);
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> List<T> instancesOf(Class<T> type) {
        lock.readLock().lock();
        try {
            List<T> out = new ArrayList<>();
            for (IfcEntity e : instances) {
                if (type.isInstance(e)) {
                    out.add(type.cast(e));
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> Optional<T> firstOf(Class<T> type) {
        List<T> all = instancesOf(type);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    public Optional<IfcRoot> findByGlobalId(String globalId) {
        if (globalId == null || globalId.isBlank()) {
            return Optional.empty();
        }
        String wanted = globalId.trim();
        for (IfcRoot root : instancesOf(IfcRoot.class)) {
            if (root.getGlobalId().equals(wanted)) {
                return Optional.of(root);
            }
        }
        return Optional.empty();
    }

    public Optional<IfcProject> project() {
        return firstOf(IfcProject.class);
    }

    public Optional<IfcResources.OwnerHistory> ownerHistory() {
        return firstOf(IfcResources.OwnerHistory.class);
    }

    /**
     * 模型唯一的几何表达上下文（项目初始化时创建）。
     */
    public Optional<IfcGeometry.GeometricRepresentationContext> geometricContext() {
        return project()
                .map(IfcProject::getRepresentationContexts)
                .filter(contexts -> !contexts.isEmpty())
                .map(contexts -> contexts.get(0));
    }

    // ------------------------------------------------------------------
    // 关系（反向）查询
    // ------------------------------------------------------------------

    public Optional<IfcRelations.Aggregates> decomposedBy(IfcRoot relatingObject) {
        for (IfcRelations.Aggregates rel : instancesOf(IfcRelations.Aggregates.class)) {
            if (rel.getRelatingObject() == relatingObject) {
                return Optional.of(rel);
            }
        }
        return Optional.empty();
    }

    /**
     * 查找把 {@code child} 聚合进来的父对象（项目/建筑/楼层）。
     */
    public Optional<IfcRoot> decomposes(IfcRoot child) {
        for (IfcRelations.Aggregates rel : instancesOf(IfcRelations.Aggregates.class)) {
            for (IfcRoot related : rel.getRelated()) {
                if (related == child) {
                    return Optional.of(rel.getRelatingObject());
                }
            }
        }
        return Optional.empty();
    }

    public Optional<IfcRelations.ContainedInSpatialStructure> containedInStructure(IfcSpatialStructureElement structure) {
        for (IfcRelations.ContainedInSpatialStructure rel : instancesOf(IfcRelations.ContainedInSpatialStructure.class)) {
            if (rel.getRelatingStructure() == structure) {
                return Optional.of(rel);
            }
        }
        return Optional.empty();
    }

    public Optional<IfcSpatialStructureElement> containerOf(IfcProduct element) {
        for (IfcRelations.ContainedInSpatialStructure rel : instancesOf(IfcRelations.ContainedInSpatialStructure.class)) {
            for (IfcProduct related : rel.getRelated()) {
                if (related == element) {
                    return Optional.of(rel.getRelatingStructure());
                }
            }
        }
        return Optional.empty();
    }

    public List<IfcRelations.AssociatesMaterial> materialAssociationsOf(IfcProduct element) {
        List<IfcRelations.AssociatesMaterial> out = new ArrayList<>();
        for (IfcRelations.AssociatesMaterial rel : instancesOf(IfcRelations.AssociatesMaterial.class)) {
            for (IfcProduct related : rel.getRelated()) {
                if (related == element) {
                    out.add(rel);
                    break;
                }
            }
        }
        return out;
    }

    public List<IfcRelations.SpaceBoundary> boundariesOf(IfcSpace space) {
        List<IfcRelations.SpaceBoundary> out = new ArrayList<>();
        for (IfcRelations.SpaceBoundary boundary : instancesOf(IfcRelations.SpaceBoundary.class)) {
            if (boundary.getRelatingSpace() == space) {
                out.add(boundary);
            }
        }
        return out;
    }

    /**
     * 楼层内的墙（通过空间包含关系）。
     */
    public List<IfcWallStandardCase> wallsOf(IfcBuildingStorey storey) {
        List<IfcWallStandardCase> out = new ArrayList<>();
        containedInStructure(storey).ifPresent(rel -> {
            for (IfcProduct p : rel.getRelated()) {
                if (p instanceof IfcWallStandardCase wall) {
                    out.add(wall);
                }
            }
        });
        return out;
    }

    /**
     * 在读锁下执行只读操作（序列化、校验等需要一致快照的场景）。
     */
    public <T> T read(Function<IfcModel, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(this);
        } finally {
            lock.readLock().unlock();
        }
    }
}
