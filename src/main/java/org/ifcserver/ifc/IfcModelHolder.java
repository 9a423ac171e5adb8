package org.ifcserver.ifc;

import org.ifcserver.ifc.model.IfcModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 进程内唯一的“当前模型”。
 * <p>
 * 首次 {@link #getOrCreate()} 时通过工厂创建模型；多个线程同时首次访问时工厂只执行一次
 * （volatile + 双重检查）。{@link #reset()} 丢弃当前模型，下次访问重新创建。
 */
public class IfcModelHolder {

    private static final Logger log = LoggerFactory.getLogger(IfcModelHolder.class);

    private final Supplier<IfcModel> factory;
    private final Object lock = new Object();
    private volatile IfcModel model;

    public IfcModelHolder(Supplier<IfcModel> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public IfcModel getOrCreate() {
        IfcModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (lock) {
            current = model;
            if (current == null) {
                current = Objects.requireNonNull(factory.get(), "模型工厂返回了 null");
                model = current;
                log.info("Created IFC model '{}'", current.getProjectName());
            }
            return current;
        }
    }

    /**
     * 当前模型（尚未创建时为空，不会触发创建）。
     */
    public Optional<IfcModel> current() {
        return Optional.ofNullable(model);
    }

    /**
     * 丢弃当前模型；返回被丢弃的模型（可能为空）。
     */
    public Optional<IfcModel> reset() {
        synchronized (lock) {
            IfcModel previous = model;
            model = null;
            if (previous != null) {
                log.info("Discarded IFC model '{}' ({} instances)", previous.getProjectName(), previous.size());
            }
            return Optional.ofNullable(previous);
        }
    }
}
