package sbhackathon.koala.previewStack.entity;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

@EqualsAndHashCode
@ToString
public class Environment implements Iterable<EnvironmentVariable> {

    private final List<EnvironmentVariable> variables;

    public Environment(List<EnvironmentVariable> variables) {
        this.variables = List.copyOf(variables);
    }

    public static Environment empty() {
        return new Environment(List.of());
    }

    public List<EnvironmentVariable> getVariables() {
        return variables;
    }

    public Optional<EnvironmentVariable> get(String key) {
        return variables.stream()
                .filter(variable -> variable.getKey().equals(key))
                .findFirst();
    }

    public boolean hasReplicatedVariables() {
        return variables.stream().anyMatch(EnvironmentVariable::isReplicate);
    }

    public boolean isEmpty() {
        return variables.isEmpty();
    }

    @Override
    public Iterator<EnvironmentVariable> iterator() {
        return variables.iterator();
    }
}
