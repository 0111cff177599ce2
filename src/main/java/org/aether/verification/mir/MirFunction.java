package org.aether.verification.mir;

import lombok.Getter;

import java.util.*;

/**
 * 已降级为控制流图的函数，作为验证核心的输入。
 * 局部变量 0 保存返回值。
 */
@Getter
public final class MirFunction {

    public static final int RETURN_LOCAL = 0;

    private final String name;
    private final Map<Integer, Local> locals;
    private final List<Integer> parameters;
    private final int entryBlock;
    private final Map<Integer, BasicBlock> blocks;

    private MirFunction(Builder builder) {
        this.name = builder.name;
        this.locals = Collections.unmodifiableMap(new TreeMap<>(builder.locals));
        this.parameters = List.copyOf(builder.parameters);
        this.entryBlock = builder.entryBlock;
        this.blocks = Collections.unmodifiableMap(new TreeMap<>(builder.blocks));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<Local> getLocal(int id) {
        return Optional.ofNullable(locals.get(id));
    }

    public Optional<BasicBlock> getBlock(int id) {
        return Optional.ofNullable(blocks.get(id));
    }

    public LocalType typeOf(int local) {
        Local l = locals.get(local);
        return l == null ? LocalType.INTEGER : l.getType();
    }

    @Override
    public String toString() {
        return "fn " + name + locals.values() + " entry bb" + entryBlock + " " + blocks.values();
    }

    public static final class Builder {

        private final String name;
        private final Map<Integer, Local> locals = new LinkedHashMap<>();
        private final List<Integer> parameters = new ArrayList<>();
        private int entryBlock;
        private final Map<Integer, BasicBlock> blocks = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Function name cannot be null.");
        }

        public Builder returnLocal(LocalType type) {
            return local(Local.temp(RETURN_LOCAL, type));
        }

        public Builder local(Local local) {
            locals.put(local.getId(), local);
            return this;
        }

        public Builder parameter(Local local) {
            local(local);
            parameters.add(local.getId());
            return this;
        }

        public Builder entry(int block) {
            this.entryBlock = block;
            return this;
        }

        public Builder block(int id, List<Statement> statements, Terminator terminator) {
            blocks.put(id, new BasicBlock(id, statements, terminator));
            return this;
        }

        public Builder block(int id, Terminator terminator) {
            return block(id, List.of(), terminator);
        }

        public MirFunction build() {
            return new MirFunction(this);
        }
    }
}
