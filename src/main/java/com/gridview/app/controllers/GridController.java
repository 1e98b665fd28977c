package com.gridview.app.controllers;

import com.gridview.app.models.CellPosition;
import com.gridview.app.models.SelectionDto;
import com.gridview.app.models.SessionView;
import com.gridview.app.services.EditorSessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for driving an editor session.
 * "/grid" is the base path; every other route is scoped by session id.
 * Mutating routes return the updated session view for rendering.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private EditorSessionService editorService;

    /**
     * POST /grid
     * Optional JSON body: { "rows": [["a","b"],["c","d"]] }.
     * Without rows the session starts with a blank default grid.
     * Returns the session id.
     */
    @PostMapping
    public ResponseEntity<Long> createSession(@RequestBody(required = false) Map<String, List<List<String>>> request) {
        List<List<String>> rows = request == null ? null : request.get("rows");
        long sessionId = rows == null ? editorService.createSession() : editorService.createSession(rows);
        return ResponseEntity.ok(sessionId);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionView> getSession(@PathVariable long sessionId) {
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable long sessionId) {
        editorService.closeSession(sessionId);
        return ResponseEntity.ok().build();
    }

    // ------------------------
    // Selection and navigation
    // ------------------------

    /**
     * PUT /grid/{sessionId}/selection
     * Body: { "type": "range", "startRow": 0, "startCol": 0, "endRow": 1, "endCol": 1 }
     */
    @PutMapping("/{sessionId}/selection")
    public ResponseEntity<SessionView> select(@PathVariable long sessionId, @RequestBody SelectionDto selection) {
        editorService.select(sessionId, selection.toSelection());
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/selection/all")
    public ResponseEntity<SessionView> selectAll(@PathVariable long sessionId) {
        editorService.selectAll(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    /**
     * POST /grid/{sessionId}/move?rows=1&cols=0&extend=false
     */
    @PostMapping("/{sessionId}/move")
    public ResponseEntity<SessionView> move(@PathVariable long sessionId,
                                           @RequestParam(defaultValue = "0") int rows,
                                           @RequestParam(defaultValue = "0") int cols,
                                           @RequestParam(defaultValue = "false") boolean extend) {
        editorService.move(sessionId, rows, cols, extend);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    /**
     * DELETE /grid/{sessionId}/selection/cells
     * Empties the selected cells (delete key).
     */
    @DeleteMapping("/{sessionId}/selection/cells")
    public ResponseEntity<SessionView> clearSelectedCells(@PathVariable long sessionId) {
        editorService.clearSelectedCells(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @DeleteMapping("/{sessionId}/cell/{row}/{col}")
    public ResponseEntity<SessionView> clearCell(@PathVariable long sessionId,
                                                @PathVariable int row,
                                                @PathVariable int col) {
        editorService.clearCell(sessionId, row, col);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    // ------------------------
    // Editing
    // ------------------------

    @PostMapping("/{sessionId}/edit/{row}/{col}")
    public ResponseEntity<SessionView> beginEdit(@PathVariable long sessionId,
                                                @PathVariable int row,
                                                @PathVariable int col) {
        editorService.beginEdit(sessionId, row, col);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    /**
     * POST /grid/{sessionId}/text
     * Body: typed text (plain). Starts or extends an edit.
     */
    @PostMapping(value = "/{sessionId}/text", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<SessionView> typeText(@PathVariable long sessionId, @RequestBody String text) {
        editorService.typeText(sessionId, text);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    /**
     * PUT /grid/{sessionId}/edit/buffer
     * Body: full replacement text for the edit buffer (plain).
     */
    @PutMapping(value = "/{sessionId}/edit/buffer", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<SessionView> updateEditBuffer(@PathVariable long sessionId,
                                                       @RequestBody(required = false) String text) {
        editorService.updateEditBuffer(sessionId, text == null ? "" : text);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/edit/commit")
    public ResponseEntity<SessionView> commitEdit(@PathVariable long sessionId) {
        editorService.commitEdit(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/edit/confirm")
    public ResponseEntity<SessionView> confirmEdit(@PathVariable long sessionId) {
        editorService.confirmEdit(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/edit/cancel")
    public ResponseEntity<SessionView> cancelEdit(@PathVariable long sessionId) {
        editorService.cancelEdit(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    // ------------------------
    // Clipboard
    // ------------------------

    @PostMapping(value = "/{sessionId}/copy", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> copy(@PathVariable long sessionId) {
        return ResponseEntity.ok(editorService.copy(sessionId));
    }

    @PostMapping(value = "/{sessionId}/cut", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> cut(@PathVariable long sessionId) {
        return ResponseEntity.ok(editorService.cut(sessionId));
    }

    /**
     * POST /grid/{sessionId}/paste
     * Body: tab/newline separated text (plain). Without a body the
     * server-side clipboard is pasted.
     */
    @PostMapping(value = "/{sessionId}/paste")
    public ResponseEntity<SessionView> paste(@PathVariable long sessionId,
                                            @RequestBody(required = false) String text) {
        if (text == null) {
            editorService.pasteFromClipboard(sessionId);
        } else {
            editorService.paste(sessionId, text);
        }
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    // ------------------------
    // History
    // ------------------------

    @PostMapping("/{sessionId}/undo")
    public ResponseEntity<SessionView> undo(@PathVariable long sessionId) {
        editorService.undo(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/redo")
    public ResponseEntity<SessionView> redo(@PathVariable long sessionId) {
        editorService.redo(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    // ------------------------
    // Rows and columns
    // ------------------------

    @PostMapping("/{sessionId}/rows")
    public ResponseEntity<SessionView> addRow(@PathVariable long sessionId) {
        editorService.addRow(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/columns")
    public ResponseEntity<SessionView> addColumn(@PathVariable long sessionId) {
        editorService.addColumn(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/rows/{row}")
    public ResponseEntity<SessionView> insertRow(@PathVariable long sessionId, @PathVariable int row) {
        editorService.insertRowAt(sessionId, row);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/columns/{col}")
    public ResponseEntity<SessionView> insertColumn(@PathVariable long sessionId, @PathVariable int col) {
        editorService.insertColumnAt(sessionId, col);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @DeleteMapping("/{sessionId}/rows/{row}")
    public ResponseEntity<SessionView> deleteRow(@PathVariable long sessionId, @PathVariable int row) {
        editorService.deleteRow(sessionId, row);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @DeleteMapping("/{sessionId}/columns/{col}")
    public ResponseEntity<SessionView> deleteColumn(@PathVariable long sessionId, @PathVariable int col) {
        editorService.deleteColumn(sessionId, col);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PutMapping("/{sessionId}/columns/{col}/width")
    public ResponseEntity<SessionView> setColumnWidth(@PathVariable long sessionId,
                                                     @PathVariable int col,
                                                     @RequestParam double width) {
        editorService.setColumnWidth(sessionId, col, width);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    // ------------------------
    // Search and sort
    // ------------------------

    /**
     * GET /grid/{sessionId}/search?query=abc&caseSensitive=false
     * Returns matches in row-major order.
     */
    @GetMapping("/{sessionId}/search")
    public ResponseEntity<List<CellPosition>> search(@PathVariable long sessionId,
                                                     @RequestParam String query,
                                                     @RequestParam(defaultValue = "false") boolean caseSensitive) {
        return ResponseEntity.ok(editorService.search(sessionId, query, caseSensitive));
    }

    @PostMapping("/{sessionId}/search/next")
    public ResponseEntity<SessionView> nextResult(@PathVariable long sessionId) {
        editorService.nextResult(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PostMapping("/{sessionId}/search/prev")
    public ResponseEntity<SessionView> prevResult(@PathVariable long sessionId) {
        editorService.prevResult(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    /**
     * POST /grid/{sessionId}/sort/{col}?ascending=true
     */
    @PostMapping("/{sessionId}/sort/{col}")
    public ResponseEntity<SessionView> sort(@PathVariable long sessionId,
                                           @PathVariable int col,
                                           @RequestParam(defaultValue = "true") boolean ascending) {
        editorService.sortByColumn(sessionId, col, ascending);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    @PutMapping("/{sessionId}/frozen-header")
    public ResponseEntity<SessionView> setFrozenHeader(@PathVariable long sessionId, @RequestParam boolean frozen) {
        editorService.setFrozenHeader(sessionId, frozen);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    // ------------------------
    // Documents
    // ------------------------

    /**
     * PUT /grid/{sessionId}/document?name=data.csv
     * Body: CSV bytes. Replaces the grid; a 400 leaves it untouched.
     */
    @PutMapping(value = "/{sessionId}/document", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<SessionView> loadDocument(@PathVariable long sessionId,
                                                   @RequestParam(defaultValue = "untitled.csv") String name,
                                                   @RequestBody byte[] bytes) {
        editorService.loadDocument(sessionId, bytes, name);
        return ResponseEntity.ok(editorService.view(sessionId));
    }

    /**
     * POST /grid/{sessionId}/document/pending?name=data.csv
     * Queues CSV bytes for the next poll.
     */
    @PostMapping(value = "/{sessionId}/document/pending", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<Void> offerDocument(@PathVariable long sessionId,
                                              @RequestParam(defaultValue = "untitled.csv") String name,
                                              @RequestBody byte[] bytes) {
        editorService.offerDocument(sessionId, bytes, name);
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{sessionId}/document/poll")
    public ResponseEntity<Boolean> pollDocument(@PathVariable long sessionId) {
        return ResponseEntity.ok(editorService.pollPendingDocument(sessionId));
    }

    /**
     * GET /grid/{sessionId}/document
     * Returns the grid as CSV and marks the session clean.
     */
    @GetMapping(value = "/{sessionId}/document", produces = "text/csv")
    public ResponseEntity<byte[]> saveDocument(@PathVariable long sessionId) {
        byte[] bytes = editorService.saveDocument(sessionId);
        String name = editorService.view(sessionId).getDocumentName();
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(name == null ? "untitled.csv" : name)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(bytes);
    }

    @PostMapping("/{sessionId}/document/new")
    public ResponseEntity<SessionView> newDocument(@PathVariable long sessionId) {
        editorService.newDocument(sessionId);
        return ResponseEntity.ok(editorService.view(sessionId));
    }
}
