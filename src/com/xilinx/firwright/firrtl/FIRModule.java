/*
 *
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of FIRWright.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.firwright.firrtl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A module in a FIRRTL circuit: an ordered list of ports and a body of
 * statements kept in document order.
 */
public class FIRModule extends FIRAnnotatedObject {

    private FIRCircuit circuit;

    private FIRVisibility visibility = FIRVisibility.PUBLIC;

    private FIRConvention convention = FIRConvention.INTERNAL;

    private final List<FIRPort> ports = new ArrayList<>();

    private final List<FIRStatement> body = new ArrayList<>();

    public FIRModule(String name) {
        super(name);
    }

    public FIRModule(String name, FIRVisibility visibility, FIRConvention convention) {
        super(name);
        this.visibility = visibility;
        this.convention = convention;
    }

    /**
     * Creates a new module with an empty body and the same ports (including their
     * inner symbols and annotations), convention and annotations as the prototype.
     * The new module is not added to any circuit and is public.
     * @param name Name of the new module
     * @param orig Prototype module
     */
    public FIRModule(String name, FIRModule orig) {
        super(orig);
        setName(name);
        this.convention = orig.convention;
        for (FIRPort p : orig.ports) {
            addPort(new FIRPort(p));
        }
    }

    public FIRCircuit getCircuit() {
        return circuit;
    }

    protected void setCircuit(FIRCircuit circuit) {
        this.circuit = circuit;
    }

    public FIRVisibility getVisibility() {
        return visibility;
    }

    public void setVisibility(FIRVisibility visibility) {
        this.visibility = visibility;
    }

    public boolean isPublic() {
        return visibility == FIRVisibility.PUBLIC;
    }

    public void setPrivate() {
        setVisibility(FIRVisibility.PRIVATE);
    }

    public FIRConvention getConvention() {
        return convention;
    }

    public void setConvention(FIRConvention convention) {
        this.convention = convention;
    }

    /**
     * Appends a port to this module.  Checks for a name collision.
     * @param port The port to add
     * @return The port that was added
     */
    public FIRPort addPort(FIRPort port) {
        if (getPortIndex(port.getName()) >= 0) {
            throw new RuntimeException("ERROR: Port name collision on FIRModule " + getName()
                    + ", trying to add port " + port.getName() + " which already exists.");
        }
        port.setParentModule(this);
        ports.add(port);
        return port;
    }

    public FIRPort createPort(String name, FIRDirection direction) {
        return addPort(new FIRPort(name, direction));
    }

    public FIRPort createPort(String name, FIRDirection direction, String innerSym) {
        return addPort(new FIRPort(name, direction, innerSym));
    }

    public List<FIRPort> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    public int getNumPorts() {
        return ports.size();
    }

    public FIRPort getPort(int index) {
        return ports.get(index);
    }

    public FIRPort getPort(String name) {
        int idx = getPortIndex(name);
        return idx < 0 ? null : ports.get(idx);
    }

    public int getPortIndex(String name) {
        for (int i = 0; i < ports.size(); i++) {
            if (ports.get(i).getName().equals(name)) return i;
        }
        return -1;
    }

    public FIRDirection getPortDirection(int index) {
        return ports.get(index).getDirection();
    }

    public String getPortSymbol(int index) {
        return ports.get(index).getInnerSym();
    }

    /**
     * The i-th port as a value inside this module's body.
     */
    public FIRValue getArgument(int index) {
        return FIRValue.ofPort(this, index);
    }

    public FIRValue getArgument(String portName) {
        int idx = getPortIndex(portName);
        return idx < 0 ? null : getArgument(idx);
    }

    /**
     * Appends a statement at the end of the body.
     */
    public <T extends FIRStatement> T addStatement(T statement) {
        statement.setParentModule(this);
        body.add(statement);
        return statement;
    }

    /**
     * Inserts a statement in the body at the given position (0 is the start of the body).
     */
    public <T extends FIRStatement> T insertStatement(int index, T statement) {
        statement.setParentModule(this);
        body.add(index, statement);
        return statement;
    }

    public FIRInstance createInstance(String name, FIRModule module, String innerSym) {
        return addStatement(new FIRInstance(name, module, innerSym));
    }

    public FIRConnect createConnect(FIRValue dest, FIRValue src) {
        return addStatement(new FIRConnect(dest, src));
    }

    public List<FIRStatement> getBody() {
        return Collections.unmodifiableList(body);
    }

    /**
     * Collects body statements of a certain type in document order.
     */
    public <T extends FIRStatement> List<T> getStatements(Class<T> type) {
        List<T> list = new ArrayList<>();
        for (FIRStatement s : body) {
            if (type.isInstance(s)) list.add(type.cast(s));
        }
        return list;
    }

    public List<FIRInstance> getInstances() {
        return getStatements(FIRInstance.class);
    }

    public List<FIRComponent> getComponents() {
        return getStatements(FIRComponent.class);
    }

    public List<FIRConnect> getConnects() {
        return getStatements(FIRConnect.class);
    }

    public List<FIRProbe> getProbes() {
        return getStatements(FIRProbe.class);
    }

    public FIRInstance getInstance(String name) {
        for (FIRInstance i : getInstances()) {
            if (i.getName().equals(name)) return i;
        }
        return null;
    }

    public FIRComponent getComponent(String name) {
        for (FIRComponent c : getComponents()) {
            if (c.getName().equals(name)) return c;
        }
        return null;
    }

    /**
     * Finds the port or body statement declaring an inner symbol.
     * @param innerSym The inner symbol to look up
     * @return The {@link FIRPort} or {@link FIRStatement} declaring it, or null
     */
    public Object lookupInnerSym(String innerSym) {
        for (FIRPort p : ports) {
            if (innerSym.equals(p.getInnerSym())) return p;
        }
        for (FIRStatement s : body) {
            if (innerSym.equals(s.getInnerSym())) return s;
        }
        return null;
    }

    /**
     * @return All inner symbols declared by ports and body statements, in order.
     * Duplicates are reported as many times as they are declared.
     */
    public List<String> getInnerSymbols() {
        List<String> syms = new ArrayList<>();
        for (FIRPort p : ports) {
            if (p.getInnerSym() != null) syms.add(p.getInnerSym());
        }
        for (FIRStatement s : body) {
            if (s.getInnerSym() != null) syms.add(s.getInnerSym());
        }
        return syms;
    }

    /**
     * Removes all annotations from all ports of this module.
     */
    public void removePortAnnotations() {
        for (FIRPort p : ports) {
            p.setAnnotations(null);
        }
    }

    @Override
    public String toString() {
        return "module " + getName();
    }
}
