package com.scorebook.core.assemble;

import com.scorebook.core.model.AnomalyKind;
import com.scorebook.core.model.ScorebookException;

/** La lista de jugadas no describe un partido terminado. Fatal sólo para ese partido. */
public class IncompleteGameDataException extends ScorebookException {
    private final String gameId;

    public IncompleteGameDataException(String gameId, String message) {
        super(AnomalyKind.INCOMPLETE_GAME_DATA, "Game " + gameId + ": " + message);
        this.gameId = gameId;
    }

    public String gameId() { return gameId; }
}
