package com.iimsoft.gantt.domain;

/**
 * The single renewable resource pool shared by all tasks.
 */
public class GlobalResource extends AbstractPersistable {

    private int capacity;

    public GlobalResource() {
    }

    public GlobalResource(long id, int capacity) {
        super(id);
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

}
